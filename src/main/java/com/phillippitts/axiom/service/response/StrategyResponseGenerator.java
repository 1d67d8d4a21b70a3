package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Selects a {@link ResponseStrategy} by intent name, using the default strategy for intents
 * without a dedicated one.
 */
public class StrategyResponseGenerator implements ResponseGenerator {

    private static final Logger LOG = LogManager.getLogger(StrategyResponseGenerator.class);

    private final Map<String, ResponseStrategy> strategies;
    private final ResponseStrategy defaultStrategy;

    public StrategyResponseGenerator(Map<String, ResponseStrategy> strategies, ResponseStrategy defaultStrategy) {
        this.strategies = Map.copyOf(Objects.requireNonNull(strategies, "strategies must not be null"));
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy must not be null");
    }

    @Override
    public GeneratedResponse generate(Intent intent, SessionContext context) {
        Objects.requireNonNull(intent, "intent must not be null");
        ResponseStrategy strategy = strategies.getOrDefault(intent.name(), defaultStrategy);
        GeneratedResponse response = strategy.respond(intent, context);
        LOG.debug("Generated response for intent '{}' via {} (variant={})",
                intent.name(), response.strategy(), response.variantIndex());
        return response;
    }
}
