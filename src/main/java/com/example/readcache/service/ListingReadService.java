package com.example.readcache.service;

import com.example.readcache.backend.CatalogPage;
import com.example.readcache.backend.MockCatalogBackend;
import com.example.readcache.config.CatalogProperties;
import com.example.readcache.core.Cache;
import com.example.readcache.keys.CacheKeys;
import com.example.readcache.keys.ListArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Listing reads for controls and faqs. The shared cache sits inside the request memo:
 * the memo dedupes repeats within one request, the cache dedupes across requests.
 */
@Service
public class ListingReadService {

    private static final Logger log = LoggerFactory.getLogger(ListingReadService.class);

    private final Cache<Object> cache;
    private final MockCatalogBackend backend;
    private final RequestMemo memo;
    private final long readTtlSeconds;

    public ListingReadService(Cache<Object> cache, MockCatalogBackend backend, RequestMemo memo,
                              CatalogProperties properties) {
        this.cache = cache;
        this.backend = backend;
        this.memo = memo;
        this.readTtlSeconds = properties.getReadTtlSeconds();
    }

    public CatalogPage controlsPage(ListArgs args, String authScope) throws Exception {
        String memoKey = "listingReadService:controlsPage:" + CacheKeys.authScope(authScope)
                + ":" + CacheKeys.controlsKey(args);
        return memo.memoize(memoKey,
                () -> cachedPage(CacheKeys.CONTROLS, CacheKeys.controlsReadKey(args, authScope), args));
    }

    public CatalogPage faqsPage(ListArgs args, String authScope) throws Exception {
        String memoKey = "listingReadService:faqsPage:" + CacheKeys.authScope(authScope)
                + ":" + CacheKeys.faqsKey(args);
        return memo.memoize(memoKey,
                () -> cachedPage(CacheKeys.FAQS, CacheKeys.faqsReadKey(args, authScope), args));
    }

    private CatalogPage cachedPage(String entity, String cacheKey, ListArgs args) throws Exception {
        log.debug("[cache] read key={} ttl={}s", cacheKey, readTtlSeconds);
        return (CatalogPage) cache.fetchOrCompute(cacheKey, readTtlSeconds, () -> backend.fetchPage(entity, args));
    }
}
