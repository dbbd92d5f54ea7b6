package com.tradejournal.application.service;

import com.tradejournal.domain.port.RelayFailureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shuts the process down with a non-zero exit code when the relay consumer
 * cannot make progress, so a supervisor restarts it from the last committed offset.
 */
@Component
public class ProcessExitFailureListener implements RelayFailureListener {

    private static final Logger log = LoggerFactory.getLogger(ProcessExitFailureListener.class);

    public static final int EXIT_CODE = 70;

    private final ConfigurableApplicationContext context;
    private final AtomicBoolean exiting = new AtomicBoolean();

    public ProcessExitFailureListener(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatalFailure(String source, Throwable cause) {
        if (!exiting.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress, ignoring failure at {}", source);
            return;
        }
        log.error("Relay consumer failed at {}, shutting down with exit code {}", source, EXIT_CODE, cause);
        // Closing the context stops the listener container, which waits for the calling thread
        Thread exitThread = new Thread(() -> terminate(SpringApplication.exit(context, () -> EXIT_CODE)),
                "relay-fatal-exit");
        exitThread.start();
    }

    public boolean isExiting() {
        return exiting.get();
    }

    protected void terminate(int exitCode) {
        System.exit(exitCode);
    }
}
