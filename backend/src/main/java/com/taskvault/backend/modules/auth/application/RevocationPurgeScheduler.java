package com.taskvault.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Drops expired revocation entries held in process memory, including the Redis store's local fallback.
 */
public class RevocationPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(RevocationPurgeScheduler.class);

    private final TokenRevocationRegistry registry;

    public RevocationPurgeScheduler(TokenRevocationRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${app.auth.revocation.purge-interval:PT10M}")
    public void purgeExpiredEntries() {
        int purged = registry.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired revocation entries", purged);
        }
    }
}
