package com.phillippitts.axiom.config.response;

import com.phillippitts.axiom.config.properties.ResponseProperties;
import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.service.response.BackendResponseStrategy;
import com.phillippitts.axiom.service.response.GenerationBackend;
import com.phillippitts.axiom.service.response.ResponseGenerator;
import com.phillippitts.axiom.service.response.ResponseStrategy;
import com.phillippitts.axiom.service.response.StrategyResponseGenerator;
import com.phillippitts.axiom.service.response.TemplateResponseStrategy;
import com.phillippitts.axiom.service.response.UnavailableGenerationBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template responses for every intent, with configured intents routed to the generation backend.
 */
@Configuration
public class ResponseConfig {

    private static final Logger LOG = LogManager.getLogger(ResponseConfig.class);

    static final String DEFAULT_FALLBACK =
            "I'm not sure how to help with that. Could you try rephrasing your question?";

    /**
     * Placeholder backend; any real {@link GenerationBackend} bean replaces it.
     */
    @Bean
    @ConditionalOnMissingBean(GenerationBackend.class)
    public GenerationBackend generationBackend() {
        return new UnavailableGenerationBackend();
    }

    @Bean
    public TemplateResponseStrategy templateResponseStrategy(ResponseProperties properties) {
        Map<String, List<String>> templates = new LinkedHashMap<>(properties.getTemplates());
        templates.putIfAbsent(Intent.FALLBACK, List.of(DEFAULT_FALLBACK));
        LOG.info("Template strategy loaded {} intent template sets", templates.size());
        return new TemplateResponseStrategy(templates);
    }

    @Bean
    public ResponseGenerator responseGenerator(ResponseProperties properties,
                                               TemplateResponseStrategy templateStrategy,
                                               GenerationBackend backend) {
        Map<String, ResponseStrategy> routed = new LinkedHashMap<>();
        if (!properties.getBackendIntents().isEmpty()) {
            BackendResponseStrategy backendStrategy =
                    new BackendResponseStrategy(backend, properties.getBackendHistoryTurns());
            properties.getBackendIntents().forEach(intent -> routed.put(intent, backendStrategy));
            LOG.info("Intents {} routed to generation backend '{}'", properties.getBackendIntents(), backend.name());
        }
        return new StrategyResponseGenerator(routed, templateStrategy);
    }
}
