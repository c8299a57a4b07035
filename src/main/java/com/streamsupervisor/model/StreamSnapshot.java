package com.streamsupervisor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable point-in-time view of one stream, as returned by the registry and the API.
 */
@Value
@Builder(toBuilder = true)
public class StreamSnapshot {
    String id;
    String sourcePath;
    StreamStatus status;
    int loopCount;
    String rtspUrl;
    Instant startedAt;
    ErrorKind lastErrorKind;
    String lastError;

    public boolean isRunning() {
        return status == StreamStatus.RUNNING;
    }
}
