package com.example.readcache.remote;

import com.example.readcache.core.BackendNotImplementedException;
import com.example.readcache.core.Cache;
import com.example.readcache.core.PrefixInvalidation;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Placeholder for a network-backed cache. Every operation fails immediately so a
 * misconfigured deployment shows up as errors rather than as a cache that always misses.
 */
public class RemoteCache<V> implements Cache<V> {

    static final String BACKEND_NAME = "RemoteCache";

    @Override
    public Optional<V> get(String key) {
        throw new BackendNotImplementedException(BACKEND_NAME, "get");
    }

    @Override
    public void set(String key, V value, long ttlSeconds) {
        throw new BackendNotImplementedException(BACKEND_NAME, "set");
    }

    @Override
    public void delete(String key) {
        throw new BackendNotImplementedException(BACKEND_NAME, "delete");
    }

    @Override
    public Optional<PrefixInvalidation> prefixInvalidation() {
        return Optional.empty();
    }

    @Override
    public V fetchOrCompute(String key, long ttlSeconds, Callable<? extends V> producer) {
        throw new BackendNotImplementedException(BACKEND_NAME, "fetchOrCompute");
    }
}
