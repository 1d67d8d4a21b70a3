package com.phillippitts.axiom.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for durable persistence.
 */
@Validated
@ConfigurationProperties(prefix = "axiom.store")
public class StoreProperties {

    @Min(1)
    private final int maxAttempts;

    @Min(0)
    private final long initialBackoffMs;

    @DecimalMin("1.0")
    private final double backoffMultiplier;

    /**
     * Turns and events older than this are purged; 0 keeps everything.
     */
    @Min(0)
    private final int retentionDays;

    @ConstructorBinding
    public StoreProperties(Integer maxAttempts, Long initialBackoffMs, Double backoffMultiplier,
                           Integer retentionDays) {
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.initialBackoffMs = initialBackoffMs == null ? 1_000L : initialBackoffMs;
        this.backoffMultiplier = backoffMultiplier == null ? 2.0 : backoffMultiplier;
        this.retentionDays = retentionDays == null ? 30 : retentionDays;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public int getRetentionDays() {
        return retentionDays;
    }
}
