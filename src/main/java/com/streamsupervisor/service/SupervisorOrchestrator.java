package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import com.streamsupervisor.model.StreamResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Startup: media server gate, directory subscription, initial scan and auto-start.
 * Shutdown: stops every stream before the context goes away so no encoder outlives
 * the supervisor. Runs after the embedded web server is listening.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupervisorOrchestrator implements ApplicationRunner {
    static final int WATCHER_FAILURE_EXIT_CODE = 2;

    private final SupervisorConfig config;
    private final StreamRegistry registry;
    private final DirectoryWatcher watcher;
    private final MediaServerProbe mediaServerProbe;
    private final ApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Stream supervisor starting...");
        if (config.getMediaServer().isWaitForReady()) {
            mediaServerProbe.awaitReady();
        }

        watcher.start(this::onWatcherFailure);
        watcher.scan();

        if (config.isAutoStart()) {
            List<StreamResult> results = registry.startAll();
            long started = results.stream().filter(StreamResult::isSuccess).count();
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("Initial start of {} failed: {}", r.getId(), r.getMessage()));
            log.info("Initial sync complete: {} of {} streams started", started, results.size());
        } else {
            log.info("Initial sync complete: {} streams registered, auto-start disabled", registry.list().size());
        }
    }

    void onWatcherFailure(Throwable error) {
        log.error("Hot-reload is no longer possible, shutting down", error);
        // exit from a fresh thread, the failing watcher thread is joined during context close
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> WATCHER_FAILURE_EXIT_CODE)),
                "supervisor-exit");
        exit.start();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stream supervisor shutting down");
        watcher.stop();
        List<StreamResult> results = registry.stopAll();
        results.stream()
                .filter(r -> !r.isSuccess())
                .forEach(r -> log.warn("Stopping {} failed: {}", r.getId(), r.getMessage()));
        log.info("Stopped {} streams", results.size());
    }
}
