package com.example.readcache.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.RequestScope;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Per-request memo: identical reads within one HTTP request share one computation.
 * A failed computation is forgotten so a retry in the same request runs again.
 */
@Component
@RequestScope
public class RequestMemo {

    private static final Logger log = LoggerFactory.getLogger(RequestMemo.class);

    private final ConcurrentHashMap<String, CompletableFuture<Object>> memo = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> T memoize(String key, Callable<T> fn) throws Exception {
        CompletableFuture<Object> fresh = new CompletableFuture<>();
        CompletableFuture<Object> existing = memo.putIfAbsent(key, fresh);
        if (existing != null) {
            log.debug("[memo] hit key={}", key);
            return (T) await(existing);
        }

        log.debug("[memo] miss key={}", key);
        try {
            T value = fn.call();
            fresh.complete(value);
            return value;
        } catch (Throwable t) {
            memo.remove(key, fresh);
            log.debug("[memo] evict-on-error key={}", key);
            fresh.completeExceptionally(t);
            throw t;
        }
    }

    public int size() {
        return memo.size();
    }

    private static Object await(CompletableFuture<Object> future) throws Exception {
        try {
            return future.get();
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
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
