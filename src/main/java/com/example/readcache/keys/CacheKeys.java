package com.example.readcache.keys;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic cache keys for listing reads.
 *
 * <p>Keys look like {@code controls:list:role=public:first=10:category=soc2}. The entity
 * segment comes first so that {@link InvalidationScope} can drop every cached view of
 * one entity with a single prefix. Absent arguments are left out, so "no filter" and
 * "filter not passed" map to the same key.
 */
public final class CacheKeys {

    public static final String CONTROLS = "controls";
    public static final String FAQS = "faqs";

    static final int DEFAULT_PAGE_SIZE = 10;
    static final int MAX_PAGE_SIZE = 50;
    static final String DEFAULT_AUTH_SCOPE = "public";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CacheKeys() {
    }

    /** Raw key, arguments exactly as given. Used for per-request memo identity. */
    public static String controlsKey(ListArgs args) {
        return listKey(CONTROLS, args);
    }

    public static String faqsKey(ListArgs args) {
        return listKey(FAQS, args);
    }

    /** Normalized key for the shared cache, scoped by the caller's auth scope. */
    public static String controlsReadKey(ListArgs args, String authScope) {
        return readKey(CONTROLS, args, authScope);
    }

    public static String faqsReadKey(ListArgs args, String authScope) {
        return readKey(FAQS, args, authScope);
    }

    public static String listPrefix(String entity) {
        return entity + ":list:";
    }

    static String listKey(String entity, ListArgs args) {
        List<String> parts = new ArrayList<>();
        parts.add(entity + ":list");
        appendArgs(parts, args);
        return String.join(":", parts);
    }

    static String readKey(String entity, ListArgs args, String authScope) {
        List<String> parts = new ArrayList<>();
        parts.add(entity + ":list");
        parts.add("role=" + authScope(authScope));
        appendArgs(parts, normalize(args));
        return String.join(":", parts);
    }

    static ListArgs normalize(ListArgs args) {
        Integer first = args.first() == null ? null : clampFirst(args.first());
        String after = null;
        if (args.after() != null && !args.after().trim().isEmpty()) {
            after = args.after().trim();
        }
        return new ListArgs(first, after, normalizeText(args.category()), normalizeText(args.search()));
    }

    static int clampFirst(int first) {
        if (first <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(first, MAX_PAGE_SIZE);
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String normalized = WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    /** Normalized auth scope: trimmed, lower-cased, {@code public} when absent. */
    public static String authScope(String authScope) {
        if (authScope == null || authScope.trim().isEmpty()) {
            return DEFAULT_AUTH_SCOPE;
        }
        return authScope.trim().toLowerCase(Locale.ROOT);
    }

    private static void appendArgs(List<String> parts, ListArgs args) {
        if (args.first() != null) parts.add("first=" + args.first());
        if (args.after() != null) parts.add("after=" + args.after());
        if (args.category() != null) parts.add("category=" + args.category());
        if (args.search() != null) parts.add("search=" + args.search());
    }
}
