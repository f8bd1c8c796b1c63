package com.example.readcache.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedExpiringCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @Test
    void shouldEvictLeastRecentlyUsedWhenCapacityExceeded() {
        var cache = new BoundedExpiringCache<String>(2, clock);

        cache.set("a", "1", 60);
        cache.set("b", "2", 60);
        cache.set("c", "3", 60);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("2");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void shouldNeverHoldMoreThanMaxItems() {
        var cache = new BoundedExpiringCache<Integer>(5, clock);

        for (int i = 0; i < 100; i++) {
            cache.set("k" + i, i, 60);
            assertThat(cache.size()).isLessThanOrEqualTo(5);
        }
        for (int i = 95; i < 100; i++) {
            assertThat(cache.get("k" + i)).contains(i);
        }
    }

    @Test
    void shouldPromoteEntryOnRead() {
        var cache = new BoundedExpiringCache<String>(2, clock);

        cache.set("a", "1", 60);
        cache.set("b", "2", 60);
        assertThat(cache.get("a")).contains("1");
        cache.set("c", "3", 60);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void shouldNotGrowWhenReplacingExistingKey() {
        var cache = new BoundedExpiringCache<String>(2, clock);

        cache.set("a", "1", 60);
        cache.set("b", "2", 60);
        cache.set("a", "1b", 60);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a")).contains("1b");
        assertThat(cache.get("b")).contains("2");
    }

    @Test
    void shouldTreatReplacedKeyAsMostRecent() {
        var cache = new BoundedExpiringCache<String>(2, clock);

        cache.set("a", "1", 60);
        cache.set("b", "2", 60);
        cache.set("a", "1b", 60);
        cache.set("c", "3", 60);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1b");
    }

    @Test
    void shouldExpireEntryAfterTtl() {
        var cache = new BoundedExpiringCache<String>(10, clock);

        cache.set("k", "v", 1);
        clock.advance(Duration.ofMillis(900));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofMillis(200));
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.stats().expirations()).isEqualTo(1);
    }

    @Test
    void shouldBeAbsentExactlyAtExpiryInstant() {
        var cache = new BoundedExpiringCache<String>(10, clock);

        cache.set("k", "v", 2);
        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void shouldNotCountExpiredEntriesTowardCapacity() {
        var cache = new BoundedExpiringCache<String>(2, clock);

        cache.set("short", "x", 1);
        cache.set("long", "y", 60);
        clock.advance(Duration.ofMillis(1100));
        cache.set("new", "z", 60);

        // the expired entry goes, not the live LRU one
        assertThat(cache.get("long")).contains("y");
        assertThat(cache.get("new")).contains("z");
        assertThat(cache.stats().evictions()).isZero();
    }

    @Test
    void shouldStoreNothingForNonPositiveTtl() {
        var cache = new BoundedExpiringCache<String>(10, clock);

        cache.set("k", "v", 60);
        cache.set("k", "v2", 0);
        cache.set("other", "v", -5);

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.get("other")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldDeleteIdempotently() {
        var cache = new BoundedExpiringCache<String>(10, clock);

        cache.delete("missing");
        cache.set("k", "v", 60);
        cache.delete("k");
        cache.delete("k");

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldInvalidateOnlyMatchingPrefix() {
        var cache = new BoundedExpiringCache<String>(10, clock);
        cache.set("controls:1", "v1", 60);
        cache.set("controls:2", "v2", 60);
        cache.set("faqs:1", "v3", 60);

        int removed = cache.prefixInvalidation().orElseThrow().invalidatePrefix("controls:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("controls:1")).isEmpty();
        assertThat(cache.get("controls:2")).isEmpty();
        assertThat(cache.get("faqs:1")).contains("v3");
    }

    @Test
    void shouldKeepRecencyConsistentAfterInvalidation() {
        var cache = new BoundedExpiringCache<String>(2, clock);
        cache.set("controls:1", "v1", 60);
        cache.set("faqs:1", "v2", 60);

        cache.invalidatePrefix("controls:");
        cache.set("faqs:2", "v3", 60);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("faqs:1")).contains("v2");
        assertThat(cache.get("faqs:2")).contains("v3");
    }

    @Test
    void shouldPurgeExpiredEntriesEagerly() {
        var cache = new BoundedExpiringCache<String>(10, clock);
        cache.set("a", "1", 1);
        cache.set("b", "2", 1);
        cache.set("c", "3", 60);

        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.purgeExpired()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldCountHitsAndMisses() {
        var cache = new BoundedExpiringCache<String>(10, clock);
        cache.set("a", "1", 60);

        cache.get("a");
        cache.get("a");
        cache.get("b");

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.maxItems()).isEqualTo(10);
    }

    @Test
    void shouldResetOnClear() {
        var cache = new BoundedExpiringCache<String>(10, clock);
        cache.set("a", "1", 60);
        cache.get("a");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.stats().hits()).isZero();
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedExpiringCache<String>(0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSurviveHugeTtl() {
        var cache = new BoundedExpiringCache<String>(10, clock);

        cache.set("k", "v", Long.MAX_VALUE);
        clock.advance(Duration.ofDays(3650));

        assertThat(cache.get("k")).contains("v");
    }
}
