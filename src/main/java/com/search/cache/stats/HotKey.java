package com.search.cache.stats;

/**
 * A frequently read key and its access count since the last reset.
 *
 * @param key      hex form of the cache key
 * @param accesses number of lookups that hit or missed this key
 */
public record HotKey(String key, long accesses) {
}
