package com.phillippitts.axiom.config;

import com.phillippitts.axiom.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for turn processing and response generation.
 *
 * <p>Both pools copy the Log4j2 ThreadContext (MDC) of the submitting thread so that
 * sessionId and turnId follow a turn across threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs submitted turns. Rejection policy is {@link ThreadPoolExecutor.AbortPolicy}: a full
     * queue surfaces as a failed turn instead of running on the HTTP thread.
     */
    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor() {
        return build(threadPoolProperties.getTurn(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs response strategies under the turn deadline. Also {@link ThreadPoolExecutor.AbortPolicy}:
     * generation never runs on the turn thread, where the deadline could not interrupt it, and a
     * saturated pool degrades the turn to the apology response.
     */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor() {
        return build(threadPoolProperties.getGeneration(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
