package com.example.readcache.backend;

import java.time.Instant;
import java.util.List;

public record CatalogPage(
        String entity,
        List<String> items,
        boolean hasNextPage,
        Instant fetchedAt
) {}
