package com.example.readcache.eviction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LruEvictionStrategyTest {

    @Test
    void shouldEvictInInsertionOrderWithoutHits() {
        var lru = new LruEvictionStrategy();
        lru.onInsert("a");
        lru.onInsert("b");
        lru.onInsert("c");

        assertThat(lru.selectVictim()).contains("a");
        assertThat(lru.selectVictim()).contains("b");
        assertThat(lru.selectVictim()).contains("c");
        assertThat(lru.selectVictim()).isEmpty();
    }

    @Test
    void shouldMoveHitKeyToFront() {
        var lru = new LruEvictionStrategy();
        lru.onInsert("a");
        lru.onInsert("b");
        lru.onInsert("c");

        lru.onHit("a");

        assertThat(lru.selectVictim()).contains("b");
        assertThat(lru.selectVictim()).contains("c");
        assertThat(lru.selectVictim()).contains("a");
    }

    @Test
    void shouldForgetRemovedKeys() {
        var lru = new LruEvictionStrategy();
        lru.onInsert("a");
        lru.onInsert("b");
        lru.onInsert("c");

        lru.onRemove("b");
        lru.onRemove("a");
        lru.onRemove("missing");

        assertThat(lru.selectVictim()).contains("c");
        assertThat(lru.selectVictim()).isEmpty();
    }

    @Test
    void shouldIgnoreHitOnUnknownKey() {
        var lru = new LruEvictionStrategy();
        lru.onInsert("a");

        lru.onHit("ghost");

        assertThat(lru.selectVictim()).contains("a");
        assertThat(lru.selectVictim()).isEmpty();
    }

    @Test
    void shouldStartOverAfterClear() {
        var lru = new LruEvictionStrategy();
        lru.onInsert("a");
        lru.onInsert("b");

        lru.clear();
        lru.onInsert("c");

        assertThat(lru.selectVictim()).contains("c");
        assertThat(lru.selectVictim()).isEmpty();
    }
}
