package com.example.readcache.core;

public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        int size,
        int maxItems,
        int inFlight
) {}
