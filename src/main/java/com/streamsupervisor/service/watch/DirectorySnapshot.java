package com.streamsupervisor.service.watch;

import com.streamsupervisor.model.FileEvent;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Regular files of a directory with their size and modification time.
 */
@Slf4j
final class DirectorySnapshot {
    private final Map<Path, FileState> files;

    private DirectorySnapshot(Map<Path, FileState> files) {
        this.files = files;
    }

    static DirectorySnapshot take(Path directory) throws IOException {
        Map<Path, FileState> files = new HashMap<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.forEach(path -> {
                try {
                    if (Files.isRegularFile(path)) {
                        files.put(path, new FileState(Files.size(path), Files.getLastModifiedTime(path).toMillis()));
                    }
                } catch (IOException e) {
                    // vanished between list and stat, the next snapshot reports it
                    log.debug("Skipping {}: {}", path, e.toString());
                }
            });
        }
        return new DirectorySnapshot(files);
    }

    /**
     * Emits the events that turn {@code this} into {@code current}.
     */
    void diff(DirectorySnapshot current, Consumer<FileEvent> sink) {
        current.files.forEach((path, state) -> {
            FileState previous = files.get(path);
            if (previous == null) {
                sink.accept(new FileEvent(FileEvent.Kind.CREATED, path));
            } else if (!previous.equals(state)) {
                sink.accept(new FileEvent(FileEvent.Kind.MODIFIED, path));
            }
        });
        files.keySet().stream()
                .filter(path -> !current.files.containsKey(path))
                .forEach(path -> sink.accept(new FileEvent(FileEvent.Kind.REMOVED, path)));
    }

    @Value
    private static class FileState {
        long size;
        long modified;
    }
}
