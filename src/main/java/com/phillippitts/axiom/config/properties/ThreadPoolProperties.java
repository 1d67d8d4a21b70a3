package com.phillippitts.axiom.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The turn pool runs whole turns; the generation pool runs response strategies so a slow
 * backend can be abandoned at the turn deadline without blocking the turn thread.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private PoolProperties turn = new PoolProperties(4, 16, 100, "turn-pool-");
    @Valid
    private PoolProperties generation = new PoolProperties(2, 8, 50, "generation-pool-");

    public PoolProperties getTurn() {
        return turn;
    }

    public void setTurn(PoolProperties turn) {
        this.turn = turn;
    }

    public PoolProperties getGeneration() {
        return generation;
    }

    public void setGeneration(PoolProperties generation) {
        this.generation = generation;
    }

    /**
     * Sizing for one executor. {@code maxPoolSize} below {@code corePoolSize} is raised to it.
     */
    public static class PoolProperties {
        @Min(1)
        private int corePoolSize;
        @Min(1)
        private int maxPoolSize;
        @Min(0)
        private int queueCapacity;
        @Min(0)
        private int keepAliveSeconds = 60;
        /** How long shutdown waits for running turns to finish. */
        @Min(0)
        private int awaitTerminationSeconds = 30;
        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return Math.max(maxPoolSize, corePoolSize);
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
