package com.example.readcache.service;

import com.example.readcache.core.BoundedExpiringCache;
import com.example.readcache.core.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired entries from the local cache so memory does not creep
 * up with keys nobody reads again. Reads already treat expired entries as absent; this
 * only reclaims space. Does nothing for other backends.
 */
@Component
public class ExpirySweepJob {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweepJob.class);

    private final Cache<Object> cache;

    public ExpirySweepJob(Cache<Object> cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${cache.sweep-interval-ms:60000}")
    public void sweepExpired() {
        if (!(cache instanceof BoundedExpiringCache)) {
            return;
        }
        int removed = ((BoundedExpiringCache<Object>) cache).purgeExpired();
        if (removed > 0) {
            log.info("Expiry sweep removed {} entries", removed);
        }
    }
}
