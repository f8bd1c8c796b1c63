package com.example.readcache.backend;

import com.example.readcache.config.CatalogProperties;
import com.example.readcache.keys.ListArgs;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stands in for the database behind listing reads: slow, and counted so callers can see
 * how many reads actually got past the cache.
 */
@Component
public class MockCatalogBackend {

    private static final int TOTAL_ITEMS = 120;
    private static final int DEFAULT_PAGE_SIZE = 10;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final Clock clock;
    private final long latencyMillis;

    public MockCatalogBackend(CatalogProperties properties, Clock clock) {
        this.latencyMillis = properties.getLatencyMillis();
        this.clock = clock;
    }

    // Simulates a slow listing query
    public CatalogPage fetchPage(String entity, ListArgs args) {
        requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException("interrupted while reading " + entity, e);
        }
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new CatalogUnavailableException("catalog unavailable while reading " + entity);
        }

        int pageSize = args.first() == null || args.first() <= 0 ? DEFAULT_PAGE_SIZE : args.first();
        int offset = parseCursor(args.after());
        String category = args.category() == null ? "all" : args.category();

        List<String> items = new ArrayList<>();
        for (int i = offset; i < Math.min(offset + pageSize, TOTAL_ITEMS); i++) {
            items.add(entity + "-" + category + "-" + i);
        }
        return new CatalogPage(entity, items, offset + pageSize < TOTAL_ITEMS, clock.instant());
    }

    /** Makes the next {@code n} reads fail after their latency. */
    public void failNextRequests(int n) {
        failuresRemaining.set(n);
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    private static int parseCursor(String after) {
        if (after == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(after.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
