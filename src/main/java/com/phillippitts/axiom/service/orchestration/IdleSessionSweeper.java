package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.config.properties.ContextProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically ends sessions that have been idle longer than {@code axiom.context.idle-timeout}.
 */
@Component
public class IdleSessionSweeper {

    private static final Logger LOG = LogManager.getLogger(IdleSessionSweeper.class);

    private final TurnOrchestrator orchestrator;
    private final ContextProperties properties;

    public IdleSessionSweeper(TurnOrchestrator orchestrator, ContextProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${axiom.context.sweep-interval-ms:60000}",
            initialDelayString = "${axiom.context.sweep-interval-ms:60000}")
    public void sweep() {
        int ended = orchestrator.endIdleSessions(properties.getIdleTimeout());
        if (ended > 0) {
            LOG.info("Ended {} idle session(s) (idle timeout {})", ended, properties.getIdleTimeout());
        }
    }
}
