package com.streamsupervisor.service.watch;

import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.FileEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.function.Consumer;

/**
 * {@link WatchService} backed source. An OVERFLOW falls back to a snapshot diff.
 */
@Slf4j
public class NativeWatchEventSource implements WatchEventSource {
    private final Path directory;
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public NativeWatchEventSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public void start(Consumer<FileEvent> sink, Consumer<Throwable> onFailure) {
        DirectorySnapshot baseline;
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_DELETE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
            baseline = DirectorySnapshot.take(directory);
        } catch (IOException e) {
            close();
            throw StreamException.watcherFailure("Cannot watch " + directory, e);
        }

        running = true;
        thread = new Thread(() -> loop(baseline, sink, onFailure), "watch-native");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} for changes (native)", directory);
    }

    private void loop(DirectorySnapshot baseline, Consumer<FileEvent> sink, Consumer<Throwable> onFailure) {
        DirectorySnapshot known = baseline;
        try {
            while (running) {
                WatchKey key = watchService.take();
                boolean overflow = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        overflow = true;
                        continue;
                    }
                    Path path = directory.resolve((Path) event.context());
                    sink.accept(new FileEvent(toKind(event.kind()), path));
                }
                if (overflow) {
                    log.warn("Watch events overflowed for {}, rescanning", directory);
                    DirectorySnapshot current = DirectorySnapshot.take(directory);
                    known.diff(current, sink);
                    known = current;
                }
                if (!key.reset()) {
                    throw new IOException("Watch key for " + directory + " is no longer valid");
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service for {} closed", directory);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (running) {
                onFailure.accept(StreamException.watcherFailure("Watch on " + directory + " failed", e));
            }
        }
    }

    private static FileEvent.Kind toKind(WatchEvent.Kind<?> kind) {
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            return FileEvent.Kind.CREATED;
        }
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            return FileEvent.Kind.REMOVED;
        }
        return FileEvent.Kind.MODIFIED;
    }

    @Override
    public void close() {
        running = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service: {}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
