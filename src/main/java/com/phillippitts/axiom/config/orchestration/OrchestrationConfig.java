package com.phillippitts.axiom.config.orchestration;

import com.phillippitts.axiom.config.properties.ContextProperties;
import com.phillippitts.axiom.config.properties.PipelineProperties;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.context.ContextStore;
import com.phillippitts.axiom.service.context.InMemoryContextStore;
import com.phillippitts.axiom.service.intent.IntentDetector;
import com.phillippitts.axiom.service.metrics.TurnMetrics;
import com.phillippitts.axiom.service.orchestration.DefaultTurnOrchestrator;
import com.phillippitts.axiom.service.orchestration.TurnOrchestrator;
import com.phillippitts.axiom.service.policy.PolicyEngine;
import com.phillippitts.axiom.service.response.ResponseGenerator;
import com.phillippitts.axiom.service.store.DurableStore;
import com.phillippitts.axiom.service.store.PersistenceTracker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the turn orchestrator and the session context store explicitly.
 */
@Configuration
public class OrchestrationConfig {

    /**
     * Sessions created after a restart continue the sequence recorded in the durable store.
     */
    @Bean
    public ContextStore contextStore(ContextProperties properties, DurableStore durableStore) {
        return new InMemoryContextStore(properties.getMaxHistory(), durableStore::latestSequenceNumber);
    }

    @Bean
    public TurnOrchestrator turnOrchestrator(PolicyEngine policyEngine,
                                             IntentDetector intentDetector,
                                             ContextStore contextStore,
                                             ResponseGenerator responseGenerator,
                                             EventBus eventBus,
                                             PersistenceTracker persistenceTracker,
                                             TurnMetrics metrics,
                                             PipelineProperties pipelineProperties,
                                             @Qualifier("turnExecutor") Executor turnExecutor,
                                             @Qualifier("generationExecutor") Executor generationExecutor) {
        return new DefaultTurnOrchestrator(policyEngine, intentDetector, contextStore, responseGenerator,
                eventBus, persistenceTracker, metrics, pipelineProperties, turnExecutor, generationExecutor);
    }
}
