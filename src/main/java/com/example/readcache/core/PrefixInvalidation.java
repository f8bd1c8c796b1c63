package com.example.readcache.core;

/**
 * Optional cache capability: remove every entry whose key starts with a literal prefix.
 */
@FunctionalInterface
public interface PrefixInvalidation {

    /**
     * @param prefix literal key prefix, e.g. {@code "controls:list:"}
     * @return number of entries removed
     */
    int invalidatePrefix(String prefix);
}
