package com.example.readcache.config;

import java.util.Locale;
import java.util.Optional;

public enum BackendKind {
    LOCAL,
    REMOTE;

    /**
     * Parses a configured backend name. {@code lru} and {@code redis} are accepted as
     * older spellings of {@code local} and {@code remote}.
     */
    public static Optional<BackendKind> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "local":
            case "lru":
                return Optional.of(LOCAL);
            case "remote":
            case "redis":
                return Optional.of(REMOTE);
            default:
                return Optional.empty();
        }
    }
}
