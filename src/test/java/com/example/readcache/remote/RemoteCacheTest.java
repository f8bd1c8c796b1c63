package com.example.readcache.remote;

import com.example.readcache.core.BackendNotImplementedException;
import com.example.readcache.core.Cache;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteCacheTest {

    private final Cache<String> cache = new RemoteCache<>();

    @Test
    void shouldFailFastOnEveryOperation() {
        assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(BackendNotImplementedException.class)
                .hasMessageContaining("get");
        assertThatThrownBy(() -> cache.set("k", "v", 60))
                .isInstanceOf(BackendNotImplementedException.class)
                .hasMessageContaining("set");
        assertThatThrownBy(() -> cache.delete("k"))
                .isInstanceOf(BackendNotImplementedException.class)
                .hasMessageContaining("delete");
    }

    @Test
    void shouldNotRunProducerWhenFetchFails() {
        var calls = new AtomicInteger();

        assertThatThrownBy(() -> cache.fetchOrCompute("k", 60, () -> "v" + calls.incrementAndGet()))
                .isInstanceOfSatisfying(BackendNotImplementedException.class, e -> {
                    assertThat(e.getBackend()).isEqualTo("RemoteCache");
                    assertThat(e.getOperation()).isEqualTo("fetchOrCompute");
                });
        assertThat(calls).hasValue(0);
    }

    @Test
    void shouldDeclarePrefixInvalidationAbsent() {
        assertThat(cache.prefixInvalidation()).isEmpty();
    }
}
