package com.phillippitts.axiom.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Micrometer gauges for the application executors, tagged {@code pool=turn|generation}.
 *
 * <ul>
 *   <li>axiom.pool.size - current number of threads</li>
 *   <li>axiom.pool.active - threads running a task</li>
 *   <li>axiom.pool.queued - tasks waiting for a thread</li>
 *   <li>axiom.pool.completed - cumulative completed tasks</li>
 * </ul>
 *
 * <p>A queued count close to the turn pool's queue capacity means new turns are about to be
 * rejected with a SYSTEM_ERROR outcome.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ThreadPoolTaskExecutor> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(@Qualifier("turnExecutor") ThreadPoolTaskExecutor turnExecutor,
                                   @Qualifier("generationExecutor") ThreadPoolTaskExecutor generationExecutor) {
        pools.put("turn", turnExecutor);
        pools.put("generation", generationExecutor);
    }

    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            pools.forEach((name, executor) -> bind(registry, name, executor.getThreadPoolExecutor()));
            LOG.info("Thread pool metrics registered for pools {}", pools.keySet());
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("axiom.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("axiom.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads running a task")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("axiom.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting for a thread")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("axiom.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs one line per pool every 5 minutes; WARN once the queue is more than 80% full.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools.forEach((name, taskExecutor) -> {
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
            int queued = executor.getQueue().size();
            int capacity = queued + executor.getQueue().remainingCapacity();
            String line = "Pool {}: size={}/{}, active={}, queued={}/{}, completed={}";
            Object[] args = {name, executor.getPoolSize(), executor.getMaximumPoolSize(),
                    executor.getActiveCount(), queued, capacity, executor.getCompletedTaskCount()};
            if (capacity > 0 && queued * 5 > capacity * 4) {
                LOG.warn(line, args);
            } else {
                LOG.info(line, args);
            }
        });
    }
}
