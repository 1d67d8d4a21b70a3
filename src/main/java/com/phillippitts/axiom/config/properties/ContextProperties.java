package com.phillippitts.axiom.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for in-memory session context.
 */
@Validated
@ConfigurationProperties(prefix = "axiom.context")
public class ContextProperties {

    /**
     * Turns kept per session; older turns are evicted first.
     */
    @Min(1)
    private final int maxHistory;

    /**
     * Sessions without activity for this long are ended by the sweeper.
     */
    @NotNull
    private final Duration idleTimeout;

    @ConstructorBinding
    public ContextProperties(Integer maxHistory, Duration idleTimeout) {
        this.maxHistory = maxHistory == null ? 10 : maxHistory;
        this.idleTimeout = idleTimeout == null ? Duration.ofMinutes(30) : idleTimeout;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }
}
