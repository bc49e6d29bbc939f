package com.communitychallenge.platform.service;

import com.communitychallenge.platform.model.RecoverySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the completion recovery sweep once the application is up and then on a fixed delay.
 */
@Component
public class CompletionRecoveryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CompletionRecoveryScheduler.class);

    private final CompletionCoordinator completionCoordinator;

    @Autowired
    public CompletionRecoveryScheduler(CompletionCoordinator completionCoordinator) {
        this.completionCoordinator = completionCoordinator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        sweep(true);
    }

    @Scheduled(initialDelayString = "${challenge.recovery.interval-ms:60000}",
        fixedDelayString = "${challenge.recovery.interval-ms:60000}")
    public void recoverPeriodically() {
        sweep(false);
    }

    private void sweep(boolean startup) {
        try {
            RecoverySummary summary = completionCoordinator.recoverStalled(startup);
            if (summary.hasWork()) {
                logger.info("Completion recovery ({}) - resumed: {}, claimed: {}",
                    startup ? "startup" : "periodic", summary.getResumed(), summary.getClaimed());
            }
        } catch (Exception e) {
            logger.error("Error running completion recovery", e);
        }
    }
}
