package com.streamsupervisor.model;

import lombok.Value;

@Value
public class StreamResult {
    String id;
    StreamStatus status;
    int loopCount;
    boolean success;
    ErrorKind error;
    String message;

    public static StreamResult ok(StreamSnapshot snapshot) {
        return new StreamResult(snapshot.getId(), snapshot.getStatus(), snapshot.getLoopCount(),
                true, null, null);
    }

    public static StreamResult failed(StreamSnapshot snapshot, ErrorKind error, String message) {
        return new StreamResult(snapshot.getId(), snapshot.getStatus(), snapshot.getLoopCount(),
                false, error, message);
    }
}
