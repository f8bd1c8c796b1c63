package com.example.readcache.keys;

import java.util.Locale;
import java.util.Optional;

/**
 * Entities whose cached list reads can be dropped after a write.
 */
public enum InvalidationScope {
    CONTROLS(CacheKeys.CONTROLS),
    FAQS(CacheKeys.FAQS);

    private final String entity;

    InvalidationScope(String entity) {
        this.entity = entity;
    }

    public String entity() {
        return entity;
    }

    public String prefix() {
        return CacheKeys.listPrefix(entity);
    }

    public static Optional<InvalidationScope> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (InvalidationScope scope : values()) {
            if (scope.entity.equals(wanted)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
