package com.streamsupervisor.exception;

import com.streamsupervisor.model.ErrorKind;
import lombok.Getter;

/**
 * Failure of a stream operation. The kind decides how callers report it,
 * the stream id is null for failures that are not tied to one stream.
 */
@Getter
public class StreamException extends RuntimeException {
    private final ErrorKind kind;
    private final String streamId;

    public StreamException(ErrorKind kind, String streamId, String message) {
        super(message);
        this.kind = kind;
        this.streamId = streamId;
    }

    public StreamException(ErrorKind kind, String streamId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.streamId = streamId;
    }

    public static StreamException notFound(String streamId) {
        return new StreamException(ErrorKind.NOT_FOUND, streamId, "Stream not found: " + streamId);
    }

    public static StreamException namingCollision(String streamId, String existingPath, String rejectedPath) {
        return new StreamException(ErrorKind.NAMING_COLLISION, streamId,
                String.format("%s maps to stream '%s' already owned by %s", rejectedPath, streamId, existingPath));
    }

    public static StreamException spawnFailure(String streamId, Throwable cause) {
        return new StreamException(ErrorKind.PROCESS_SPAWN_FAILURE, streamId,
                "Failed to launch encoder for " + streamId + ": " + cause.getMessage(), cause);
    }

    public static StreamException watcherFailure(String message, Throwable cause) {
        return new StreamException(ErrorKind.WATCHER_FAILURE, null, message, cause);
    }
}
