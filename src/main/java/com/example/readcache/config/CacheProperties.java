package com.example.readcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw cache settings. Values stay strings so a malformed environment variable
 * falls back to a default instead of failing startup; see {@link BackendSelector}.
 */
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    private String maxItems = String.valueOf(BackendSelector.DEFAULT_MAX_ITEMS);
    private String backend = "local";

    public String getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(String maxItems) {
        this.maxItems = maxItems;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }
}
