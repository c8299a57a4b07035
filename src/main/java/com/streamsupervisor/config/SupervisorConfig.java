package com.streamsupervisor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "supervisor")
public class SupervisorConfig {
    @NotBlank
    private String videosDir = "/app/videos";
    @NotEmpty
    private List<String> videoExtensions = new ArrayList<>(
            List.of("mp4", "mkv", "mov", "avi", "ts", "m4v", "webm", "flv"));
    private boolean autoStart = true;
    private boolean restartOnCrash = false;
    @NotNull
    private Duration restartDelay = Duration.ofSeconds(5);
    @Min(100)
    private long reconcileIntervalMs = 30_000;

    @Valid
    private MediaServer mediaServer = new MediaServer();
    @Valid
    private Encoder encoder = new Encoder();
    @Valid
    private Watcher watcher = new Watcher();

    public Path getVideosPath() {
        return Path.of(videosDir).toAbsolutePath().normalize();
    }

    public boolean isVideoFile(Path path) {
        String name = path.getFileName().toString();
        if (name.startsWith(".")) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return false;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return videoExtensions.stream().anyMatch(e -> e.equalsIgnoreCase(extension));
    }

    @Data
    public static class MediaServer {
        // publish side, the encoder always pushes to the local media server
        @NotBlank
        private String host = "localhost";
        @Min(1)
        @Max(65535)
        private int port = 8554;
        // host advertised to clients in the rtspUrl of every stream
        @NotBlank
        private String publicHost = "localhost";
        private boolean waitForReady = true;
        @NotNull
        private Duration readyTimeout = Duration.ofSeconds(120);

        public String publishUrl(String streamId) {
            return String.format("rtsp://%s:%d/%s", host, port, streamId);
        }

        public String publicUrl(String streamId) {
            return String.format("rtsp://%s:%d/%s", publicHost, port, streamId);
        }
    }

    @Data
    public static class Encoder {
        public static final String INPUT = "{input}";
        public static final String URL = "{url}";
        public static final String LOOP = "{loop}";
        public static final String ID = "{id}";

        @NotEmpty
        private List<String> command = new ArrayList<>(List.of(
                "ffmpeg", "-hide_banner", "-loglevel", "error",
                "-re", "-stream_loop", LOOP,
                "-i", INPUT,
                "-c", "copy", "-map", "0",
                "-f", "rtsp", "-rtsp_transport", "tcp",
                URL));
        @NotNull
        private Duration stopGracePeriod = Duration.ofSeconds(5);
        private boolean inheritOutput = false;

        @AssertTrue(message = "encoder command must reference {input} and {url}")
        public boolean isCommandComplete() {
            return command != null
                    && command.stream().anyMatch(a -> a.contains(INPUT))
                    && command.stream().anyMatch(a -> a.contains(URL));
        }
    }

    @Data
    public static class Watcher {
        public enum Mode { POLLING, NATIVE }

        @NotNull
        private Mode mode = Mode.POLLING;
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(2);
        @NotNull
        private Duration debounce = Duration.ofSeconds(1);
        @Min(16)
        private int queueCapacity = 1024;
    }
}
