package com.example.readcache.config;

import com.example.readcache.core.Cache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the one cache instance shared by every request for the life of the process.
 * The backend is chosen once here from {@code cache.backend} / {@code CACHE_BACKEND}.
 */
@Configuration
@EnableConfigurationProperties({CacheProperties.class, CatalogProperties.class})
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Cache<Object> readCache(CacheProperties cacheProperties, Clock clock) {
        return BackendSelector.create(cacheProperties, clock);
    }
}
