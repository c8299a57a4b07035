package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.ErrorKind;
import com.streamsupervisor.model.StreamSnapshot;
import com.streamsupervisor.model.StreamStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class DirectoryWatcherTest {

    @TempDir
    Path videos;

    private SupervisorConfig config;
    private FakeProcessRunner runner;
    private StreamRegistry registry;
    private DirectoryWatcher watcher;

    @BeforeEach
    void setUp() {
        config = new SupervisorConfig();
        config.setVideosDir(videos.toString());
        config.getWatcher().setPollInterval(Duration.ofMillis(50));
        config.getWatcher().setDebounce(Duration.ofMillis(150));
        runner = new FakeProcessRunner();
        registry = new StreamRegistry(config, runner);
        watcher = new DirectoryWatcher(config, registry);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
        registry.shutdown();
    }

    @Test
    void scan_registersRecognizedVideosOnly() throws IOException {
        Files.writeString(videos.resolve("sailboat.mp4"), "x");
        Files.writeString(videos.resolve("Trailer.MKV"), "x");
        Files.writeString(videos.resolve(".partial.mp4"), "x");
        Files.writeString(videos.resolve("notes.txt"), "x");
        Files.writeString(videos.resolve("README"), "x");
        Files.createDirectory(videos.resolve("extras.mp4"));

        List<StreamSnapshot> found = watcher.scan();

        assertThat(found).extracting(StreamSnapshot::getId).containsExactlyInAnyOrder("sailboat", "trailer");
        assertThat(found).allMatch(s -> s.getStatus() == StreamStatus.STOPPED);
        assertThat(runner.started).isEmpty();
    }

    @Test
    void scan_firstNameWinsCollision(CapturedOutput output) throws IOException {
        Files.writeString(videos.resolve("b_clip.mkv"), "x");
        Files.writeString(videos.resolve("B Clip.mp4"), "x");

        List<StreamSnapshot> found = watcher.scan();

        assertThat(found).hasSize(1);
        assertThat(registry.get("b_clip").getSourcePath()).endsWith("B Clip.mp4");
        assertThat(output).containsPattern("ERROR.*Skipping b_clip\\.mkv");
    }

    @Test
    void settle_newFileIsRegisteredAndStartedLooping() throws IOException {
        Path file = Files.writeString(videos.resolve("Ocean Waves.mp4"), "x");

        watcher.settle(file);

        StreamSnapshot snapshot = registry.get("ocean_waves");
        assertThat(snapshot.getStatus()).isEqualTo(StreamStatus.RUNNING);
        assertThat(snapshot.getLoopCount()).isEqualTo(-1);
    }

    @Test
    void settle_alreadyRegisteredFileIsLeftAlone() throws IOException {
        Path file = Files.writeString(videos.resolve("sailboat.mp4"), "x");
        registry.upsert(file);

        watcher.settle(file);

        assertThat(registry.get("sailboat").getStatus()).isEqualTo(StreamStatus.STOPPED);
        assertThat(runner.started).isEmpty();
    }

    @Test
    void settle_removedFileStopsAndForgetsStream() throws IOException {
        Path file = Files.writeString(videos.resolve("sailboat.mp4"), "x");
        watcher.settle(file);
        assertThat(runner.liveCount("sailboat")).isEqualTo(1);

        Files.delete(file);
        watcher.settle(file);

        assertThat(runner.liveCount("sailboat")).isZero();
        assertThat(registry.list()).isEmpty();
        assertThatThrownBy(() -> registry.get("sailboat"))
                .isInstanceOf(StreamException.class)
                .extracting(e -> ((StreamException) e).getKind())
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void settle_collidingFileDoesNotDisturbOwner(CapturedOutput output) throws IOException {
        Path owner = Files.writeString(videos.resolve("My Video.mp4"), "x");
        watcher.settle(owner);
        Path rival = Files.writeString(videos.resolve("my_video.mkv"), "x");

        watcher.settle(rival);
        Files.delete(rival);
        watcher.settle(rival);

        StreamSnapshot snapshot = registry.get("my_video");
        assertThat(snapshot.getSourcePath()).endsWith("My Video.mp4");
        assertThat(snapshot.getStatus()).isEqualTo(StreamStatus.RUNNING);
        assertThat(runner.started).hasSize(1);
        assertThat(output).containsPattern("ERROR.*Video added but not streamed");
    }

    @Test
    void settle_ignoresUnrecognizedFiles() throws IOException {
        Path file = Files.writeString(videos.resolve("cover.jpg"), "x");

        watcher.settle(file);

        assertThat(registry.list()).isEmpty();
    }

    @Test
    void start_picksUpFilesWrittenInSeveralChunksOnce() throws Exception {
        watcher.start(error -> { });

        Path file = videos.resolve("upload.mp4");
        try (OutputStream out = Files.newOutputStream(file)) {
            for (int i = 0; i < 5; i++) {
                out.write(new byte[1024]);
                out.flush();
                Thread.sleep(30);
            }
        }
        awaitTrue(() -> registry.list().stream().anyMatch(StreamSnapshot::isRunning));
        Thread.sleep(400);

        assertThat(runner.started).hasSize(1);
        assertThat(registry.get("upload").getLoopCount()).isEqualTo(-1);

        Files.delete(file);
        awaitTrue(() -> registry.list().isEmpty());
        assertThat(runner.liveCount("upload")).isZero();
    }

    @Test
    void settleWindow_outlastsAPollInPollingMode() {
        config.getWatcher().setPollInterval(Duration.ofSeconds(2));
        config.getWatcher().setDebounce(Duration.ofSeconds(1));
        assertThat(watcher.settleWindowMs()).isEqualTo(3000);

        config.getWatcher().setMode(SupervisorConfig.Watcher.Mode.NATIVE);
        assertThat(watcher.settleWindowMs()).isEqualTo(1000);
    }

    @Test
    void start_waitsForSlowCopyWithDebounceShorterThanPoll() throws Exception {
        // same ratio as the shipped defaults: poll 2s, debounce 1s
        config.getWatcher().setPollInterval(Duration.ofMillis(400));
        config.getWatcher().setDebounce(Duration.ofMillis(200));
        List<Long> sizesAtStart = new CopyOnWriteArrayList<>();
        runner = new FakeProcessRunner() {
            @Override
            public StreamProcess start(String streamId, Path sourcePath, int loopCount) {
                sizesAtStart.add(sizeOf(sourcePath));
                return super.start(streamId, sourcePath, loopCount);
            }
        };
        registry.shutdown();
        registry = new StreamRegistry(config, runner);
        watcher = new DirectoryWatcher(config, registry);
        watcher.start(error -> { });

        Path file = videos.resolve("slow-copy.mp4");
        try (OutputStream out = Files.newOutputStream(file)) {
            for (int i = 0; i < 10; i++) {
                out.write(new byte[1024]);
                out.flush();
                Thread.sleep(300);
            }
        }
        awaitTrue(() -> !sizesAtStart.isEmpty());

        assertThat(sizesAtStart).containsExactly(10_240L);
        assertThat(registry.get("slow-copy").isRunning()).isTrue();
    }

    @Test
    void start_failsWhenDirectoryIsMissing() {
        config.setVideosDir(videos.resolve("missing").toString());

        assertThatThrownBy(() -> watcher.start(error -> { }))
                .isInstanceOf(StreamException.class)
                .extracting(e -> ((StreamException) e).getKind())
                .isEqualTo(ErrorKind.WATCHER_FAILURE);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }
}
