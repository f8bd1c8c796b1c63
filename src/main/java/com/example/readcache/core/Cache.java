package com.example.readcache.core;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Operations every cache backend exposes, local or remote.
 *
 * <p>Callers are wired to this interface only, so the backend can be swapped at
 * startup without touching them. A miss is never an error: reads answer with an
 * empty {@link Optional}.
 *
 * @param <V> the cached payload type
 */
public interface Cache<V> {

    /**
     * Looks up a live entry. A hit promotes the entry to most-recently-used.
     *
     * @return the value, or empty if the key is missing or expired
     */
    Optional<V> get(String key);

    /**
     * Inserts or replaces an entry. A non-positive TTL stores nothing.
     */
    void set(String key, V value, long ttlSeconds);

    /**
     * Removes an entry. Deleting a missing key is a no-op.
     */
    void delete(String key);

    /**
     * Capability query for bulk prefix removal. Backends that cannot support it
     * answer empty instead of silently ignoring the request.
     */
    Optional<PrefixInvalidation> prefixInvalidation();

    /**
     * Returns the cached value or computes it. Concurrent callers missing on the
     * same key share a single producer run; a producer failure reaches every one
     * of them and nothing is cached.
     *
     * @param key        cache key
     * @param ttlSeconds lifetime of the computed entry
     * @param producer   computes the value on a miss
     * @return the cached or freshly computed value
     * @throws Exception whatever the producer threw
     */
    V fetchOrCompute(String key, long ttlSeconds, Callable<? extends V> producer) throws Exception;
}
