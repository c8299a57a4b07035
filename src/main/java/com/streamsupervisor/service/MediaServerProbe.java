package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Waits for the media server's RTSP port to accept connections before any encoder publishes to it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MediaServerProbe {
    private static final int CONNECT_TIMEOUT_MS = 1000;
    private static final long RETRY_DELAY_MS = 1000;

    private final SupervisorConfig config;

    public boolean isReachable() {
        SupervisorConfig.MediaServer server = config.getMediaServer();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(server.getHost(), server.getPort()), CONNECT_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * @throws IllegalStateException when the port is still closed after the configured timeout
     */
    public void awaitReady() {
        SupervisorConfig.MediaServer server = config.getMediaServer();
        Duration timeout = server.getReadyTimeout();
        log.info("Waiting for media server to be available on {}:{}...", server.getHost(), server.getPort());

        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isReachable()) {
            if (System.nanoTime() >= deadline) {
                throw new IllegalStateException(String.format("Media server %s:%d not reachable after %s",
                        server.getHost(), server.getPort(), timeout));
            }
            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for media server", e);
            }
        }
        log.info("Media server is ready");
    }
}
