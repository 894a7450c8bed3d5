package com.lms.backend.modules.scan.application;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Tells running scan cycles to stop starting new sends once the application is shutting down.
 */
@Component
public class DispatchShutdownGuard implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchShutdownGuard.class);

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("Shutdown requested; pending inactivity notices will not be sent");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public void requestShutdown() {
        shuttingDown.set(true);
    }
}
