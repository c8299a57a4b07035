package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.ErrorKind;
import com.streamsupervisor.model.StreamResult;
import com.streamsupervisor.model.StreamSnapshot;
import com.streamsupervisor.model.StreamStatus;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Single authority over stream state. Operations on one id are serialized by that
 * record's lock, operations on different ids run in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamRegistry {
    private final SupervisorConfig config;
    private final ProcessRunner processRunner;
    private final ConcurrentHashMap<String, StreamRecord> records = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);
    private final ExecutorService workers = Executors.newCachedThreadPool();

    /**
     * Registers a source file, or returns the existing record for the same file.
     *
     * @throws StreamException NAMING_COLLISION when another file already owns the id
     */
    public StreamSnapshot upsert(Path sourcePath) {
        Path path = sourcePath.toAbsolutePath().normalize();
        String id = NameSanitizer.sanitize(path);
        while (true) {
            StreamRecord record = records.computeIfAbsent(id, k -> {
                log.info("Discovered stream {} from {}", k, path.getFileName());
                return new StreamRecord(k, path, config.getMediaServer().publicUrl(k));
            });
            if (record.removed) {
                // removal still in flight, replace the dead entry
                records.remove(id, record);
                continue;
            }
            if (!record.sourcePath.equals(path)) {
                throw StreamException.namingCollision(id, record.sourcePath.toString(), path.toString());
            }
            return record.snapshot();
        }
    }

    /**
     * Stops the stream backed by this file, if any, and forgets it.
     *
     * @return false when no record is backed by the file
     */
    public boolean remove(Path sourcePath) {
        Path path = sourcePath.toAbsolutePath().normalize();
        String id = NameSanitizer.sanitize(path);
        StreamRecord record = records.get(id);
        if (record == null || !record.sourcePath.equals(path)) {
            return false;
        }

        record.lock.lock();
        try {
            if (record.removed) {
                return false;
            }
            record.generation++;
            stopLocked(record);
            record.removed = true;
            records.remove(id, record);
            log.info("Removed stream {}", id);
            return true;
        } finally {
            record.lock.unlock();
        }
    }

    public StreamSnapshot start(String id, int loopCount) {
        if (loopCount < -1) {
            throw new IllegalArgumentException("loop must be -1 (infinite) or >= 0, got " + loopCount);
        }
        StreamRecord record = require(id);
        record.lock.lock();
        try {
            ensurePresent(record);
            return startLocked(record, loopCount);
        } finally {
            record.lock.unlock();
        }
    }

    public StreamSnapshot stop(String id) {
        StreamRecord record = require(id);
        record.lock.lock();
        try {
            ensurePresent(record);
            record.generation++;
            return stopLocked(record);
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Starts every stopped stream with its remembered loop count.
     */
    public List<StreamResult> startAll() {
        return applyToAll(record -> {
            record.lock.lock();
            try {
                ensurePresent(record);
                return startLocked(record, record.loopCount);
            } finally {
                record.lock.unlock();
            }
        });
    }

    public List<StreamResult> stopAll() {
        return applyToAll(record -> stop(record.id));
    }

    /**
     * True when this exact file backs a registered stream.
     */
    public boolean isRegistered(Path sourcePath) {
        Path path = sourcePath.toAbsolutePath().normalize();
        StreamRecord record = records.get(NameSanitizer.sanitize(path));
        return record != null && !record.removed && record.sourcePath.equals(path);
    }

    public StreamSnapshot get(String id) {
        StreamRecord record = require(id);
        ensurePresent(record);
        return record.snapshot();
    }

    public List<StreamSnapshot> list() {
        return records.values().stream()
                .filter(r -> !r.removed)
                .map(StreamRecord::snapshot)
                .sorted(Comparator.comparing(StreamSnapshot::getId))
                .toList();
    }

    /**
     * Corrects records whose encoder died without the exit callback having settled them yet.
     *
     * @return number of records set back to STOPPED
     */
    @Scheduled(fixedDelayString = "${supervisor.reconcile-interval-ms:30000}",
            initialDelayString = "${supervisor.reconcile-interval-ms:30000}")
    public int reconcile() {
        int corrected = 0;
        for (StreamRecord record : records.values()) {
            // busy records are mid-operation and settle themselves
            if (!record.lock.tryLock()) {
                continue;
            }
            StreamProcess exited = null;
            try {
                if (!record.removed && record.process != null && !processRunner.isAlive(record.process)) {
                    exited = record.process;
                    log.info("Process ended: {}", record.id);
                    settleExitLocked(record, exited);
                    corrected++;
                }
            } finally {
                record.lock.unlock();
            }
            if (exited != null) {
                scheduleRestartIfCrashed(record, exited);
            }
        }
        if (corrected > 0) {
            log.debug("Reconciliation set {} streams to STOPPED", corrected);
        }
        return corrected;
    }

    private StreamSnapshot startLocked(StreamRecord record, int loopCount) {
        record.generation++;
        if (record.process != null) {
            if (processRunner.isAlive(record.process)) {
                log.debug("Stream already running: {}", record.id);
                return record.snapshot();
            }
            settleExitLocked(record, record.process);
        }

        record.loopCount = loopCount;
        StreamProcess process;
        try {
            process = processRunner.start(record.id, record.sourcePath, loopCount);
        } catch (StreamException e) {
            log.error("Failed to start stream {}: {}", record.id, e.getMessage());
            record.publish(StreamStatus.STOPPED, e.getKind(), e.getMessage());
            throw e;
        }

        record.process = process;
        StreamSnapshot snapshot = record.publishRunning();
        log.info("Now playing {} (loop={})", snapshot.getRtspUrl(), loopCount);
        // runs inline when the process is already gone, the lock is reentrant
        process.onExit().thenAccept(p -> onProcessExit(record, p));
        return record.snapshot();
    }

    private StreamSnapshot stopLocked(StreamRecord record) {
        StreamProcess process = record.process;
        if (process == null) {
            return record.snapshot();
        }
        if (!processRunner.isAlive(process)) {
            // exited before its callback got the lock, record how it ended
            settleExitLocked(record, process);
            return record.snapshot();
        }
        processRunner.stop(process);
        record.process = null;
        log.info("Stopped stream: {}", record.id);
        return record.publishStopped();
    }

    private void onProcessExit(StreamRecord record, StreamProcess process) {
        record.lock.lock();
        try {
            // a later start/stop already replaced or settled this process
            if (record.process != process) {
                return;
            }
            settleExitLocked(record, process);
        } finally {
            record.lock.unlock();
        }
        scheduleRestartIfCrashed(record, process);
    }

    private void settleExitLocked(StreamRecord record, StreamProcess process) {
        record.process = null;
        if (process.isStopRequested()) {
            record.publishStopped();
        } else if (process.isCrash()) {
            String message = String.format("Encoder for %s exited with code %d", record.id, process.exitCode());
            log.error("Stream {} crashed: {}", record.id, message);
            record.publish(StreamStatus.STOPPED, ErrorKind.PROCESS_CRASH, message);
        } else {
            log.info("Stream {} finished after {} plays", record.id, process.getLoopCount() + 1);
            record.publish(StreamStatus.STOPPED, null, null);
        }
    }

    private void scheduleRestartIfCrashed(StreamRecord record, StreamProcess process) {
        if (!config.isRestartOnCrash() || !process.isCrash() || process.getLoopCount() >= 0) {
            return;
        }
        long generation;
        record.lock.lock();
        try {
            generation = record.generation;
        } finally {
            record.lock.unlock();
        }
        log.warn("Restarting {} in {}", record.id, config.getRestartDelay());
        scheduler.schedule(() -> restartAfterCrash(record, generation),
                config.getRestartDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void restartAfterCrash(StreamRecord record, long generation) {
        record.lock.lock();
        try {
            // any start, stop or removal since the crash takes precedence
            if (record.removed || record.generation != generation || record.process != null) {
                return;
            }
            startLocked(record, record.loopCount);
        } catch (StreamException e) {
            log.error("Restart of {} failed: {}", record.id, e.getMessage());
        } finally {
            record.lock.unlock();
        }
    }

    private List<StreamResult> applyToAll(Function<StreamRecord, StreamSnapshot> operation) {
        List<StreamRecord> targets = records.values().stream()
                .filter(r -> !r.removed)
                .sorted(Comparator.comparing(r -> r.id))
                .toList();
        List<CompletableFuture<StreamResult>> futures = targets.stream()
                .map(record -> CompletableFuture.supplyAsync(() -> {
                    try {
                        return StreamResult.ok(operation.apply(record));
                    } catch (StreamException e) {
                        return StreamResult.failed(record.snapshot(), e.getKind(), e.getMessage());
                    } catch (RuntimeException e) {
                        log.error("Unexpected failure on stream {}", record.id, e);
                        return StreamResult.failed(record.snapshot(), null, e.getMessage());
                    }
                }, workers))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private StreamRecord require(String id) {
        StreamRecord record = id == null ? null : records.get(id);
        if (record == null) {
            throw StreamException.notFound(id);
        }
        return record;
    }

    private void ensurePresent(StreamRecord record) {
        if (record.removed) {
            throw StreamException.notFound(record.id);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        workers.shutdown();
    }
}
