package com.streamsupervisor.service;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of one running encoder process.
 */
@Getter
public class StreamProcess {
    private final String streamId;
    private final int loopCount;
    private final Process process;
    private final Instant startedAt = Instant.now();
    private volatile boolean stopRequested;

    public StreamProcess(String streamId, int loopCount, Process process) {
        this.streamId = streamId;
        this.loopCount = loopCount;
        this.process = process;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public void markStopRequested() {
        stopRequested = true;
    }

    /**
     * Completes with this handle once the process has exited, for whatever reason.
     */
    public CompletableFuture<StreamProcess> onExit() {
        return process.onExit().thenApply(p -> this);
    }

    public int exitCode() {
        return process.exitValue();
    }

    /**
     * An exit is a crash when nobody asked for it and the loop contract says the
     * encoder should still be playing: a non-zero status, or any exit of an infinite loop.
     */
    public boolean isCrash() {
        if (stopRequested || process.isAlive()) {
            return false;
        }
        return process.exitValue() != 0 || loopCount < 0;
    }
}
