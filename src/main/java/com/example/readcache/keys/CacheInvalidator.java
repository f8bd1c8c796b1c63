package com.example.readcache.keys;

import com.example.readcache.core.Cache;
import com.example.readcache.core.PrefixInvalidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Drops every cached list read of one entity. Writers call this after their write
 * succeeds: validate, write, invalidate, respond.
 */
@Component
public class CacheInvalidator {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidator.class);

    private final Cache<?> cache;
    private final Clock clock;

    public CacheInvalidator(Cache<Object> cache, Clock clock) {
        this.cache = cache;
        this.clock = clock;
    }

    public InvalidationResult invalidate(InvalidationScope scope) {
        String prefix = scope.prefix();
        Optional<PrefixInvalidation> capability = cache.prefixInvalidation();
        if (capability.isEmpty()) {
            log.warn("[cache] backend cannot invalidate by prefix, scope={} prefix={} left as is",
                    scope.entity(), prefix);
            return new InvalidationResult(scope.entity(), prefix, 0, false, clock.instant());
        }
        int removed = capability.get().invalidatePrefix(prefix);
        log.info("[cache] invalidate scope={} prefix={} removed={}", scope.entity(), prefix, removed);
        return new InvalidationResult(scope.entity(), prefix, removed, true, clock.instant());
    }
}
