package com.example.readcache.api;

import com.example.readcache.backend.CatalogPage;
import com.example.readcache.backend.MockCatalogBackend;
import com.example.readcache.core.BoundedExpiringCache;
import com.example.readcache.core.Cache;
import com.example.readcache.keys.CacheInvalidator;
import com.example.readcache.keys.InvalidationResult;
import com.example.readcache.keys.InvalidationScope;
import com.example.readcache.keys.ListArgs;
import com.example.readcache.service.ListingReadService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ListingController {

    private final ListingReadService listings;
    private final CacheInvalidator invalidator;
    private final MockCatalogBackend backend;
    private final Cache<Object> cache;

    public ListingController(ListingReadService listings, CacheInvalidator invalidator,
                             MockCatalogBackend backend, Cache<Object> cache) {
        this.listings = listings;
        this.invalidator = invalidator;
        this.backend = backend;
        this.cache = cache;
    }

    @GetMapping("/controls")
    public CatalogPage controls(
            @RequestParam(required = false) Integer first,
            @RequestParam(required = false) String after,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "public") String scope
    ) throws Exception {
        return listings.controlsPage(new ListArgs(first, after, category, search), scope);
    }

    @GetMapping("/faqs")
    public CatalogPage faqs(
            @RequestParam(required = false) Integer first,
            @RequestParam(required = false) String after,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "public") String scope
    ) throws Exception {
        return listings.faqsPage(new ListArgs(first, after, category, search), scope);
    }

    @PostMapping("/invalidate/{scope}")
    public InvalidationResult invalidate(@PathVariable String scope) {
        InvalidationScope target = InvalidationScope.fromName(scope)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Unknown invalidation scope: " + scope));
        return invalidator.invalidate(target);
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("backendRequests", backend.getRequestCount());
        if (cache instanceof BoundedExpiringCache) {
            stats.put("cache", ((BoundedExpiringCache<Object>) cache).stats());
        }
        return stats;
    }

    @PostMapping("/reset")
    public void reset() {
        backend.resetCount();
        if (cache instanceof BoundedExpiringCache) {
            ((BoundedExpiringCache<Object>) cache).clear();
        }
    }
}
