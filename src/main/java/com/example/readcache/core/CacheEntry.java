package com.example.readcache.core;

public class CacheEntry<V> {
    public final String key;
    public final V value;
    public final long insertedAt;  // millis, creation or last refresh
    public final long expiresAt;   // absolute timestamp in millis when TTL expires

    public CacheEntry(String key, V value, long insertedAt, long expiresAt) {
        this.key = key;
        this.value = value;
        this.insertedAt = insertedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }
}
