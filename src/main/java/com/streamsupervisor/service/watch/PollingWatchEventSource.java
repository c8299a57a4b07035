package com.streamsupervisor.service.watch;

import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.FileEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Diffs directory snapshots on a fixed delay. Works on CIFS/NFS mounts where
 * inotify never fires.
 */
@Slf4j
public class PollingWatchEventSource implements WatchEventSource {
    private static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final Path directory;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "watch-poller");
        t.setDaemon(true);
        return t;
    });
    private DirectorySnapshot known;
    private int consecutiveFailures;
    private volatile boolean failed;

    public PollingWatchEventSource(Path directory, Duration interval) {
        this.directory = directory;
        this.interval = interval;
    }

    @Override
    public void start(Consumer<FileEvent> sink, Consumer<Throwable> onFailure) {
        try {
            known = DirectorySnapshot.take(directory);
        } catch (IOException e) {
            throw StreamException.watcherFailure("Cannot list " + directory, e);
        }
        log.info("Watching {} for changes (polling every {})", directory, interval);
        scheduler.scheduleWithFixedDelay(() -> poll(sink, onFailure),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void poll(Consumer<FileEvent> sink, Consumer<Throwable> onFailure) {
        if (failed) {
            return;
        }
        try {
            DirectorySnapshot current = DirectorySnapshot.take(directory);
            known.diff(current, sink);
            known = current;
            consecutiveFailures = 0;
        } catch (IOException e) {
            consecutiveFailures++;
            log.warn("Error scanning {} ({}/{}): {}", directory, consecutiveFailures,
                    MAX_CONSECUTIVE_FAILURES, e.toString());
            if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES) {
                failed = true;
                scheduler.shutdown();
                onFailure.accept(StreamException.watcherFailure("Lost access to " + directory, e));
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
