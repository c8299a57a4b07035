package com.streamsupervisor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the supervisor as a separate JVM and stops it the way a container runtime does.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SupervisorProcessExitTest {

    @TempDir
    Path work;

    @Test
    void sigtermStopsEveryEncoderAndExitsWithZero() throws Exception {
        Path videos = Files.createDirectory(work.resolve("videos"));
        Files.writeString(videos.resolve("sailboat.mp4"), "x");
        Files.writeString(videos.resolve("ocean.mp4"), "x");
        Path output = work.resolve("supervisor.log");

        Process supervisor = new ProcessBuilder(List.of(
                Path.of(System.getProperty("java.home"), "bin", "java").toString(),
                "-cp", testClasspath(),
                SupervisorApp.class.getName(),
                "--server.port=0",
                "--supervisor.videos-dir=" + videos,
                "--supervisor.media-server.wait-for-ready=false",
                "--supervisor.encoder.stop-grace-period=2s",
                "--supervisor.encoder.command[0]=sh",
                "--supervisor.encoder.command[1]=-c",
                "--supervisor.encoder.command[2]=exec sleep 60",
                "--supervisor.encoder.command[3]={input}",
                "--supervisor.encoder.command[4]={url}"))
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        try {
            awaitOutput(supervisor, output, "Initial sync complete: 2 of 2 streams started");
            List<ProcessHandle> encoders = supervisor.descendants().toList();
            assertThat(encoders).hasSizeGreaterThanOrEqualTo(2);

            supervisor.destroy();

            assertThat(supervisor.waitFor(30, TimeUnit.SECONDS)).isTrue();
            assertThat(supervisor.exitValue()).as(Files.readString(output)).isZero();
            assertThat(encoders).noneMatch(ProcessHandle::isAlive);
        } finally {
            supervisor.destroyForcibly();
        }
    }

    private static String testClasspath() {
        // surefire hides the real classpath behind a manifest-only jar
        return System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
    }

    private static void awaitOutput(Process process, Path output, String text)
            throws IOException, InterruptedException {
        long deadline = System.currentTimeMillis() + 60_000;
        while (!Files.readString(output).contains(text)) {
            if (!process.isAlive() || System.currentTimeMillis() > deadline) {
                throw new AssertionError("supervisor never logged '" + text + "':\n" + Files.readString(output));
            }
            Thread.sleep(100);
        }
    }
}
