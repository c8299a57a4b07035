package com.streamsupervisor.service;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory process whose exit is driven by the test.
 */
class FakeProcess extends Process {
    private static final AtomicLong PIDS = new AtomicLong(10_000);

    private final long pid = PIDS.incrementAndGet();
    private final CompletableFuture<Process> exit = new CompletableFuture<>();
    private volatile boolean alive = true;
    private volatile int exitCode;

    /**
     * Exits and notifies {@link #onExit()} listeners.
     */
    void exit(int code) {
        exitCode = code;
        alive = false;
        exit.complete(this);
    }

    /**
     * Dies without notifying listeners, like an exit the supervisor has not observed yet.
     */
    void dieSilently(int code) {
        exitCode = code;
        alive = false;
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        try {
            exit.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            exit.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public int exitValue() {
        if (alive) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        if (alive) {
            exit(143);
        }
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public CompletableFuture<Process> onExit() {
        return exit;
    }

    @Override
    public long pid() {
        return pid;
    }
}
