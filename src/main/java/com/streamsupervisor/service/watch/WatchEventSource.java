package com.streamsupervisor.service.watch;

import com.streamsupervisor.model.FileEvent;

import java.util.function.Consumer;

/**
 * Produces raw file events for the direct children of one directory.
 * Implementations deliver from their own thread and report a dead subscription
 * through {@code onFailure} exactly once.
 */
public interface WatchEventSource extends AutoCloseable {

    void start(Consumer<FileEvent> sink, Consumer<Throwable> onFailure);

    @Override
    void close();
}
