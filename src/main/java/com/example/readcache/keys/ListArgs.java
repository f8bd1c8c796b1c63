package com.example.readcache.keys;

/**
 * Arguments of a listing read. Every field is optional; {@code null} means "not given".
 */
public record ListArgs(Integer first, String after, String category, String search) {

    public static ListArgs empty() {
        return new ListArgs(null, null, null, null);
    }
}
