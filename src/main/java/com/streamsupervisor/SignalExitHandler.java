package com.streamsupervisor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;
import sun.misc.Signal;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns SIGTERM and SIGINT into an orderly exit with status 0: the context is closed,
 * which stops every encoder, and only then does the JVM exit.
 * Installed once the context is refreshed, before the initial sync starts any encoder.
 */
@Slf4j
class SignalExitHandler implements ApplicationListener<ApplicationStartedEvent> {
    static final List<String> SIGNALS = List.of("TERM", "INT");

    private final AtomicBoolean exiting = new AtomicBoolean();

    @Override
    public void onApplicationEvent(ApplicationStartedEvent event) {
        ConfigurableApplicationContext context = event.getApplicationContext();
        for (String name : SIGNALS) {
            try {
                Signal.handle(new Signal(name), signal -> onSignal(context, signal));
            } catch (IllegalArgumentException e) {
                log.warn("Cannot handle SIG{}, the JVM default applies: {}", name, e.getMessage());
            }
        }
    }

    private void onSignal(ConfigurableApplicationContext context, Signal signal) {
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        log.info("Received SIG{}, shutting down", signal.getName());
        System.exit(SpringApplication.exit(context));
    }
}
