package com.streamsupervisor.service;

import java.nio.file.Path;

/**
 * Owns the external encoder processes. The registry is the only caller.
 */
public interface ProcessRunner {

    /**
     * Launches the encoder for one stream and returns without waiting for it.
     *
     * @throws com.streamsupervisor.exception.StreamException with kind PROCESS_SPAWN_FAILURE
     */
    StreamProcess start(String streamId, Path sourcePath, int loopCount);

    /**
     * Terminates gracefully, force-kills after the grace period. No-op on an exited process.
     */
    void stop(StreamProcess process);

    boolean isAlive(StreamProcess process);
}
