package com.phillippitts.axiom.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for the validator chain.
 */
@Validated
@ConfigurationProperties(prefix = "axiom.policy")
public class PolicyProperties {

    @Min(1)
    private final int maxInputLength;

    @Min(1)
    private final int maxOutputLength;

    @NotNull
    private final List<String> bannedWords;

    private final boolean rejectControlCharacters;

    @Valid
    @NotNull
    private final RateLimit rateLimit;

    @ConstructorBinding
    public PolicyProperties(Integer maxInputLength, Integer maxOutputLength, List<String> bannedWords,
                            Boolean rejectControlCharacters, RateLimit rateLimit) {
        this.maxInputLength = maxInputLength == null ? 1000 : maxInputLength;
        this.maxOutputLength = maxOutputLength == null ? 500 : maxOutputLength;
        this.bannedWords = bannedWords == null ? List.of() : List.copyOf(bannedWords);
        this.rejectControlCharacters = rejectControlCharacters == null || rejectControlCharacters;
        this.rateLimit = rateLimit == null ? new RateLimit(null, null, null) : rateLimit;
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public int getMaxOutputLength() {
        return maxOutputLength;
    }

    public List<String> getBannedWords() {
        return bannedWords;
    }

    public boolean isRejectControlCharacters() {
        return rejectControlCharacters;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    /**
     * Global input rate limit; disabled by default.
     */
    public static class RateLimit {

        private final boolean enabled;

        @Min(1)
        private final long capacity;

        @NotNull
        private final Duration refillPeriod;

        public RateLimit(Boolean enabled, Long capacity, Duration refillPeriod) {
            this.enabled = enabled != null && enabled;
            this.capacity = capacity == null ? 60 : capacity;
            this.refillPeriod = refillPeriod == null ? Duration.ofMinutes(1) : refillPeriod;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public long getCapacity() {
            return capacity;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }
    }
}
