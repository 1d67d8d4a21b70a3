package com.phillippitts.axiom.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the turn pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "axiom.pipeline")
public class PipelineProperties {

    public static final String DEFAULT_DENIAL =
            "I'm sorry, but I can't help with that request. Please try rephrasing it.";
    public static final String DEFAULT_APOLOGY =
            "I apologize, but I encountered an error. Please try again.";
    public static final String DEFAULT_SAFE_FALLBACK =
            "I'm sorry, I can't share that response. Could you ask in a different way?";

    /**
     * Budget for a whole turn (session lock wait included) when the caller does not pass one.
     */
    @Min(1)
    private final long turnTimeoutMs;

    /**
     * Wait for the durable store to acknowledge each turn before returning.
     */
    private final boolean awaitPersistence;

    @Min(1)
    private final long persistenceAckTimeoutMs;

    @NotBlank
    private final String denialMessage;

    @NotBlank
    private final String apologyMessage;

    @NotBlank
    private final String safeFallbackMessage;

    @ConstructorBinding
    public PipelineProperties(Long turnTimeoutMs, Boolean awaitPersistence, Long persistenceAckTimeoutMs,
                              String denialMessage, String apologyMessage, String safeFallbackMessage) {
        this.turnTimeoutMs = turnTimeoutMs == null ? 10_000L : turnTimeoutMs;
        this.awaitPersistence = awaitPersistence != null && awaitPersistence;
        this.persistenceAckTimeoutMs = persistenceAckTimeoutMs == null ? 2_000L : persistenceAckTimeoutMs;
        this.denialMessage = denialMessage == null ? DEFAULT_DENIAL : denialMessage;
        this.apologyMessage = apologyMessage == null ? DEFAULT_APOLOGY : apologyMessage;
        this.safeFallbackMessage = safeFallbackMessage == null ? DEFAULT_SAFE_FALLBACK : safeFallbackMessage;
    }

    /**
     * Defaults everywhere except the turn timeout.
     */
    public PipelineProperties(long turnTimeoutMs) {
        this(turnTimeoutMs, null, null, null, null, null);
    }

    public long getTurnTimeoutMs() {
        return turnTimeoutMs;
    }

    public boolean isAwaitPersistence() {
        return awaitPersistence;
    }

    public long getPersistenceAckTimeoutMs() {
        return persistenceAckTimeoutMs;
    }

    public String getDenialMessage() {
        return denialMessage;
    }

    public String getApologyMessage() {
        return apologyMessage;
    }

    public String getSafeFallbackMessage() {
        return safeFallbackMessage;
    }
}
