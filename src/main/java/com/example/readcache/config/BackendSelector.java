package com.example.readcache.config;

import com.example.readcache.core.BoundedExpiringCache;
import com.example.readcache.core.Cache;
import com.example.readcache.remote.RemoteCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Resolves cache settings and builds the backend the process is wired to.
 * Invalid settings fall back to defaults with a warning.
 */
public final class BackendSelector {

    private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

    public static final int DEFAULT_MAX_ITEMS = 500;
    public static final BackendKind DEFAULT_BACKEND = BackendKind.LOCAL;

    private BackendSelector() {
    }

    public static int resolveMaxItems(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_ITEMS;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric cache max-items '{}', using default {}", raw, DEFAULT_MAX_ITEMS);
            return DEFAULT_MAX_ITEMS;
        }
        if (parsed <= 0) {
            log.warn("Non-positive cache max-items {}, using default {}", parsed, DEFAULT_MAX_ITEMS);
            return DEFAULT_MAX_ITEMS;
        }
        return parsed;
    }

    public static BackendKind resolveBackend(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_BACKEND;
        }
        return BackendKind.parse(raw).orElseGet(() -> {
            log.warn("Unknown cache backend '{}', using {}", raw, DEFAULT_BACKEND);
            return DEFAULT_BACKEND;
        });
    }

    public static <V> Cache<V> create(CacheProperties props, Clock clock) {
        BackendKind kind = resolveBackend(props.getBackend());
        if (kind == BackendKind.REMOTE) {
            log.info("Cache backend selected: remote (not implemented, every operation will fail)");
            return new RemoteCache<>();
        }
        int maxItems = resolveMaxItems(props.getMaxItems());
        log.info("Cache backend selected: local, maxItems={}", maxItems);
        return new BoundedExpiringCache<>(maxItems, clock);
    }
}
