package com.example.readcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the simulated catalog backend and the read TTLs in front of it.
 */
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    private long latencyMillis = 500;
    private long readTtlSeconds = 60;

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public void setLatencyMillis(long latencyMillis) {
        this.latencyMillis = latencyMillis;
    }

    public long getReadTtlSeconds() {
        return readTtlSeconds;
    }

    public void setReadTtlSeconds(long readTtlSeconds) {
        this.readTtlSeconds = readTtlSeconds;
    }
}
