package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.FileEvent;
import com.streamsupervisor.model.StreamSnapshot;
import com.streamsupervisor.service.watch.NativeWatchEventSource;
import com.streamsupervisor.service.watch.PollingWatchEventSource;
import com.streamsupervisor.service.watch.WatchEventSource;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Turns files appearing in and disappearing from the videos directory into registry calls.
 * Raw events go through a bounded queue to one dispatcher thread, which coalesces
 * everything seen for a path within the debounce window and then acts on the file's
 * current state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectoryWatcher {
    private final SupervisorConfig config;
    private final StreamRegistry registry;

    private BlockingQueue<FileEvent> events;
    private WatchEventSource source;
    private Thread dispatcher;
    private volatile boolean running;

    // touched by the dispatcher thread only
    private final Map<Path, Long> pending = new HashMap<>();

    /**
     * Registers every recognized video file currently in the directory. Files are
     * visited in name order, so the first name wins a naming collision.
     */
    public List<StreamSnapshot> scan() {
        Path directory = config.getVideosPath();
        log.info("Scanning {} for video files...", directory);
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(config::isVideoFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw StreamException.watcherFailure("Cannot list videos directory " + directory, e);
        }

        List<StreamSnapshot> registered = new ArrayList<>();
        for (Path file : files) {
            try {
                registered.add(registry.upsert(file));
            } catch (StreamException e) {
                log.error("Skipping {}: {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("Found {} video files in {}", registered.size(), directory);
        return registered;
    }

    /**
     * Subscribes to the directory. Call before {@link #scan()} so nothing created in
     * between is missed.
     *
     * @param onFailure invoked once if the subscription dies later on
     * @throws StreamException WATCHER_FAILURE if the subscription cannot be set up
     */
    public synchronized void start(Consumer<Throwable> onFailure) {
        if (running) {
            return;
        }
        Path directory = config.getVideosPath();
        if (!Files.isDirectory(directory)) {
            throw StreamException.watcherFailure("Videos directory does not exist: " + directory, null);
        }

        events = new ArrayBlockingQueue<>(config.getWatcher().getQueueCapacity());
        source = createSource(directory);
        source.start(this::submit, error -> {
            log.error("Directory watch failed: {}", error.getMessage());
            onFailure.accept(error);
        });

        running = true;
        dispatcher = new Thread(this::dispatchLoop, "watch-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    WatchEventSource createSource(Path directory) {
        SupervisorConfig.Watcher watcher = config.getWatcher();
        if (watcher.getMode() == SupervisorConfig.Watcher.Mode.NATIVE) {
            return new NativeWatchEventSource(directory);
        }
        return new PollingWatchEventSource(directory, watcher.getPollInterval());
    }

    void submit(FileEvent event) {
        try {
            // blocks the source when the dispatcher falls behind
            events.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * How long a path has to stay quiet before it is acted on. A polled change only
     * surfaces on the next poll, so in polling mode the window spans a full interval
     * plus the debounce: a file still being copied is seen as modified before it settles.
     */
    long settleWindowMs() {
        SupervisorConfig.Watcher watcher = config.getWatcher();
        long debounceMs = watcher.getDebounce().toMillis();
        if (watcher.getMode() == SupervisorConfig.Watcher.Mode.POLLING) {
            return watcher.getPollInterval().toMillis() + debounceMs;
        }
        return debounceMs;
    }

    private void dispatchLoop() {
        long windowMs = settleWindowMs();
        while (running) {
            try {
                FileEvent event = events.poll(nextWakeup(windowMs), TimeUnit.MILLISECONDS);
                if (event != null) {
                    log.debug("File event {} {}", event.getKind(), event.getPath().getFileName());
                    pending.put(event.getPath(), System.currentTimeMillis() + windowMs);
                }
                fireDue(System.currentTimeMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Error handling file event", e);
            }
        }
    }

    private long nextWakeup(long windowMs) {
        long now = System.currentTimeMillis();
        return pending.values().stream()
                .mapToLong(deadline -> Math.max(0, deadline - now))
                .min()
                .orElse(windowMs);
    }

    private void fireDue(long now) {
        Iterator<Map.Entry<Path, Long>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, Long> entry = it.next();
            if (entry.getValue() <= now) {
                it.remove();
                settle(entry.getKey());
            }
        }
    }

    /**
     * Acts on the state the file is in once its events have quieted down.
     */
    void settle(Path path) {
        if (!config.isVideoFile(path)) {
            log.debug("Ignoring {}", path.getFileName());
            return;
        }
        if (Files.isRegularFile(path)) {
            onPresent(path);
        } else {
            onAbsent(path);
        }
    }

    private void onPresent(Path path) {
        if (registry.isRegistered(path)) {
            return;
        }
        StreamSnapshot snapshot;
        try {
            snapshot = registry.upsert(path);
        } catch (StreamException e) {
            log.error("Video added but not streamed: {}", e.getMessage());
            return;
        }
        log.info("Video added: {}", path.getFileName());
        try {
            registry.start(snapshot.getId(), -1);
        } catch (StreamException e) {
            log.error("Could not start new stream {}: {}", snapshot.getId(), e.getMessage());
        }
    }

    private void onAbsent(Path path) {
        if (registry.remove(path)) {
            log.info("Video removed: {}", path.getFileName());
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        source.close();
        dispatcher.interrupt();
        try {
            dispatcher.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped watching {}", config.getVideosPath());
    }
}
