package com.streamsupervisor.service;

import com.streamsupervisor.config.SupervisorConfig;
import com.streamsupervisor.exception.StreamException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class FFmpegProcessRunner implements ProcessRunner {
    private static final Logger performanceLogger = LoggerFactory.getLogger("com.streamsupervisor.performance");
    private static final long FORCE_KILL_WAIT_MS = 2000;

    private final SupervisorConfig config;
    // every live child of this supervisor, keyed by pid
    private final ConcurrentHashMap<Long, StreamProcess> activeProcesses = new ConcurrentHashMap<>();

    @Override
    public StreamProcess start(String streamId, Path sourcePath, int loopCount) {
        long startTime = System.currentTimeMillis();
        List<String> command = buildCommand(streamId, sourcePath, loopCount);
        log.debug("Starting encoder for {} with command: {}", streamId, String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        if (config.getEncoder().isInheritOutput()) {
            pb.inheritIO();
        } else {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = pb.start();
        } catch (Exception e) {
            performanceLogger.error("Encoder spawn failed in {} ms for streamId: {}",
                    System.currentTimeMillis() - startTime, streamId);
            throw StreamException.spawnFailure(streamId, e);
        }

        StreamProcess handle = new StreamProcess(streamId, loopCount, process);
        long pid = process.pid();
        activeProcesses.put(pid, handle);
        handle.onExit().whenComplete((h, ex) -> activeProcesses.remove(pid));

        performanceLogger.info("Encoder spawned in {} ms for streamId: {} (pid {})",
                System.currentTimeMillis() - startTime, streamId, pid);
        return handle;
    }

    List<String> buildCommand(String streamId, Path sourcePath, int loopCount) {
        String input = sourcePath.toAbsolutePath().toString();
        String url = config.getMediaServer().publishUrl(streamId);
        List<String> command = new ArrayList<>();
        for (String arg : config.getEncoder().getCommand()) {
            command.add(arg
                    .replace(SupervisorConfig.Encoder.INPUT, input)
                    .replace(SupervisorConfig.Encoder.URL, url)
                    .replace(SupervisorConfig.Encoder.LOOP, String.valueOf(loopCount))
                    .replace(SupervisorConfig.Encoder.ID, streamId));
        }
        return command;
    }

    @Override
    public void stop(StreamProcess handle) {
        if (handle == null) {
            return;
        }
        handle.markStopRequested();
        Process process = handle.getProcess();
        if (!process.isAlive()) {
            return;
        }

        long startTime = System.currentTimeMillis();
        // wrapper scripts may have forked the real encoder
        List<ProcessHandle> descendants = process.descendants().toList();
        try {
            process.destroy();
            if (!process.waitFor(config.getEncoder().getStopGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Encoder for {} ignored SIGTERM for {}, killing it",
                        handle.getStreamId(), config.getEncoder().getStopGracePeriod());
                process.destroyForcibly();
                process.waitFor(FORCE_KILL_WAIT_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        }
        performanceLogger.info("Encoder stopped in {} ms for streamId: {}",
                System.currentTimeMillis() - startTime, handle.getStreamId());
    }

    @Override
    public boolean isAlive(StreamProcess handle) {
        return handle != null && handle.isAlive();
    }

    public List<StreamProcess> getActiveProcesses() {
        return List.copyOf(activeProcesses.values());
    }

    @PreDestroy
    public void destroyAll() {
        if (activeProcesses.isEmpty()) {
            return;
        }
        log.info("Terminating {} remaining encoder processes", activeProcesses.size());
        activeProcesses.values().parallelStream().forEach(this::stop);
    }
}
