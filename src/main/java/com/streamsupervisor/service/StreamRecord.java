package com.streamsupervisor.service;

import com.streamsupervisor.model.ErrorKind;
import com.streamsupervisor.model.StreamSnapshot;
import com.streamsupervisor.model.StreamStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry for one source file. Mutable state is guarded by {@link #lock};
 * readers only ever see the last published {@link #snapshot}.
 */
class StreamRecord {
    final String id;
    final Path sourcePath;
    private final String rtspUrl;

    // fair, so operations on one id run in the order they were accepted
    final ReentrantLock lock = new ReentrantLock(true);

    StreamProcess process;
    int loopCount = -1;
    long generation;
    volatile boolean removed;
    private volatile StreamSnapshot snapshot;

    StreamRecord(String id, Path sourcePath, String rtspUrl) {
        this.id = id;
        this.sourcePath = sourcePath;
        this.rtspUrl = rtspUrl;
        this.snapshot = StreamSnapshot.builder()
                .id(id)
                .sourcePath(sourcePath.toString())
                .status(StreamStatus.STOPPED)
                .loopCount(loopCount)
                .rtspUrl(rtspUrl)
                .build();
    }

    StreamSnapshot snapshot() {
        return snapshot;
    }

    StreamSnapshot publish(StreamStatus status, ErrorKind errorKind, String error) {
        Instant startedAt = process != null ? process.getStartedAt() : snapshot.getStartedAt();
        snapshot = snapshot.toBuilder()
                .status(status)
                .loopCount(loopCount)
                .startedAt(startedAt)
                .lastErrorKind(errorKind)
                .lastError(error)
                .build();
        return snapshot;
    }

    StreamSnapshot publishRunning() {
        return publish(StreamStatus.RUNNING, null, null);
    }

    StreamSnapshot publishStopped() {
        return publish(StreamStatus.STOPPED, snapshot.getLastErrorKind(), snapshot.getLastError());
    }
}
