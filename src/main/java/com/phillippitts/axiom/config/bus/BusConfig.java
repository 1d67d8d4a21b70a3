package com.phillippitts.axiom.config.bus;

import com.phillippitts.axiom.config.properties.BusProperties;
import com.phillippitts.axiom.service.bus.DefaultEventBus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * The process-wide event bus. It is closed with the application context, draining queued
 * deliveries for up to {@code axiom.bus.shutdown-grace-ms}.
 */
@Configuration
public class BusConfig {

    @Bean(destroyMethod = "close")
    public DefaultEventBus eventBus(BusProperties properties) {
        return new DefaultEventBus(Duration.ofMillis(properties.getShutdownGraceMs()));
    }
}
