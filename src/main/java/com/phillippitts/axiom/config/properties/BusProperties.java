package com.phillippitts.axiom.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the event bus.
 */
@Validated
@ConfigurationProperties(prefix = "axiom.bus")
public class BusProperties {

    /**
     * How long shutdown waits for queued deliveries before dropping them.
     */
    @Min(0)
    private final long shutdownGraceMs;

    /**
     * Pending deliveries above which the bus health reports DEGRADED.
     */
    @Min(1)
    private final long degradedBacklog;

    @ConstructorBinding
    public BusProperties(Long shutdownGraceMs, Long degradedBacklog) {
        this.shutdownGraceMs = shutdownGraceMs == null ? 5_000L : shutdownGraceMs;
        this.degradedBacklog = degradedBacklog == null ? 1_000L : degradedBacklog;
    }

    public long getShutdownGraceMs() {
        return shutdownGraceMs;
    }

    public long getDegradedBacklog() {
        return degradedBacklog;
    }
}
