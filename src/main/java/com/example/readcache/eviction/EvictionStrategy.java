package com.example.readcache.eviction;

import java.util.Optional;

/**
 * Tracks key recency for a bounded cache and picks eviction victims.
 * Not thread-safe: the owning cache calls it while holding its own lock.
 */
public interface EvictionStrategy {
    void onHit(String key);
    void onInsert(String key);
    void onRemove(String key);
    Optional<String> selectVictim();
    void clear();
}
