package com.example.readcache.keys;

import java.time.Instant;

public record InvalidationResult(
        String scope,
        String invalidatedPrefix,
        int removed,
        boolean supported,
        Instant invalidatedAt
) {}
