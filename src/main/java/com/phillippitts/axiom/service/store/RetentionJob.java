package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.config.properties.StoreProperties;
import com.phillippitts.axiom.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Nightly purge of turns and events older than {@code axiom.store.retention-days}.
 */
@Component
public class RetentionJob {

    private static final Logger LOG = LogManager.getLogger(RetentionJob.class);

    private final DurableStore store;
    private final StoreProperties properties;
    private final Clock clock;

    public RetentionJob(DurableStore store, StoreProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return rows deleted, 0 when retention is disabled or the purge failed
     */
    @Scheduled(cron = "${axiom.store.retention-cron:0 30 3 * * *}")
    public int purge() {
        if (properties.getRetentionDays() == 0) {
            return 0;
        }
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(properties.getRetentionDays()));
        try {
            int deleted = store.purgeOlderThan(cutoff);
            LOG.info("Retention purge removed {} row(s) older than {}", deleted, cutoff);
            return deleted;
        } catch (StorageException e) {
            LOG.error("Retention purge failed [{}]: {}", e.getErrorCode(), e.getMessage(), e);
            return 0;
        }
    }
}
