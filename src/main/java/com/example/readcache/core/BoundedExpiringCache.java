package com.example.readcache.core;

import com.example.readcache.eviction.EvictionStrategy;
import com.example.readcache.eviction.LruEvictionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local cache backend: bounded by entry count, expiring by TTL, evicting least recently used.
 *
 * <p>The entry table, the recency order and the in-flight fetch table are guarded by one
 * lock, so same-key operations are linearizable. Only {@link #fetchOrCompute} blocks, and
 * only while a producer runs; producers always run outside the lock.
 *
 * <p>A {@link #delete} racing an in-flight fetch does not cancel it: when the producer
 * finishes its value is stored (last write wins).
 */
public class BoundedExpiringCache<V> implements Cache<V>, PrefixInvalidation {

    private static final Logger log = LoggerFactory.getLogger(BoundedExpiringCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry<V>> store = new HashMap<>();
    private final Map<String, CompletableFuture<V>> inFlight = new HashMap<>();
    private final EvictionStrategy evictionStrategy;
    private final int maxItems;
    private final Clock clock;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public BoundedExpiringCache(int maxItems) {
        this(maxItems, Clock.systemUTC());
    }

    public BoundedExpiringCache(int maxItems, Clock clock) {
        this(new LruEvictionStrategy(), maxItems, clock);
    }

    public BoundedExpiringCache(EvictionStrategy evictionStrategy, int maxItems, Clock clock) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be positive, got " + maxItems);
        }
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy, "evictionStrategy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxItems = maxItems;
    }

    @Override
    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            return lookupLocked(key, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, V value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            storeLocked(key, value, ttlSeconds, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            removeLocked(key);
            inFlight.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PrefixInvalidation> prefixInvalidation() {
        return Optional.of(this);
    }

    @Override
    public int invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        lock.lock();
        try {
            List<String> doomed = new ArrayList<>();
            for (String key : store.keySet()) {
                if (key.startsWith(prefix)) {
                    doomed.add(key);
                }
            }
            doomed.forEach(this::removeLocked);
            inFlight.keySet().removeIf(key -> key.startsWith(prefix));
            log.debug("invalidated prefix={} removed={}", prefix, doomed.size());
            return doomed.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public V fetchOrCompute(String key, long ttlSeconds, Callable<? extends V> producer) throws Exception {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(producer, "producer");

        CompletableFuture<V> pending;
        boolean owner = false;

        lock.lock();
        try {
            Optional<V> cached = lookupLocked(key, clock.millis());
            if (cached.isPresent()) {
                return cached.get();
            }
            pending = inFlight.get(key);
            if (pending == null) {
                pending = new CompletableFuture<>();
                inFlight.put(key, pending);
                owner = true;
            }
        } finally {
            lock.unlock();
        }

        if (!owner) {
            log.debug("joining in-flight fetch key={}", key);
            return await(pending);
        }

        V value;
        try {
            value = producer.call();
        } catch (Throwable t) {
            lock.lock();
            try {
                inFlight.remove(key, pending);
            } finally {
                lock.unlock();
            }
            log.debug("fetch failed key={} error={}", key, t.toString());
            pending.completeExceptionally(t);
            throw t;
        }

        lock.lock();
        try {
            if (value != null) {
                storeLocked(key, value, ttlSeconds, clock.millis());
            }
            inFlight.remove(key, pending);
        } finally {
            lock.unlock();
        }
        pending.complete(value);
        return value;
    }

    /**
     * Eagerly removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        lock.lock();
        try {
            return purgeExpiredLocked(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, expirations, store.size(), maxItems, inFlight.size());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxItems() {
        return maxItems;
    }

    /**
     * Drops all entries and resets the counters. In-flight fetches keep running and
     * store their results when they finish.
     */
    public void clear() {
        lock.lock();
        try {
            store.clear();
            evictionStrategy.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            expirations = 0;
        } finally {
            lock.unlock();
        }
    }

    // --- helpers, caller holds the lock ---

    private Optional<V> lookupLocked(String key, long now) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            removeLocked(key);
            expirations++;
            misses++;
            return Optional.empty();
        }
        evictionStrategy.onHit(key);
        hits++;
        return Optional.of(entry.value);
    }

    private void storeLocked(String key, V value, long ttlSeconds, long now) {
        if (ttlSeconds <= 0) {
            // already expired on arrival
            removeLocked(key);
            return;
        }
        store.put(key, new CacheEntry<>(key, value, now, expiryOf(now, ttlSeconds)));
        evictionStrategy.onInsert(key);

        if (store.size() > maxItems) {
            purgeExpiredLocked(now);
        }
        while (store.size() > maxItems) {
            Optional<String> victim = evictionStrategy.selectVictim();
            if (victim.isEmpty()) {
                break;
            }
            store.remove(victim.get());
            evictions++;
            log.debug("evicted key={}", victim.get());
        }
    }

    private void removeLocked(String key) {
        if (store.remove(key) != null) {
            evictionStrategy.onRemove(key);
        }
    }

    private int purgeExpiredLocked(long now) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> it = store.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> e = it.next();
            if (e.getValue().isExpired(now)) {
                it.remove();
                evictionStrategy.onRemove(e.getKey());
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }

    private static long expiryOf(long now, long ttlSeconds) {
        if (ttlSeconds > (Long.MAX_VALUE - now) / 1000) {
            return Long.MAX_VALUE;
        }
        return now + ttlSeconds * 1000;
    }

    private static <T> T await(CompletableFuture<T> pending) throws Exception {
        try {
            return pending.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            // leave the flag set for the caller's thread
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
