package io.lazytable.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Strategy for choosing which cached page to drop once a page cache grows past
 * its capacity.
 * <p>
 * Each policy supplies the map that backs the cache. The victim is always the
 * first key in that map's iteration order, so the policy is fully described by
 * the ordering the map maintains.
 */
public enum EvictionPolicy {

    /**
     * Drop the lowest cached page index. Iteration order is ascending page index.
     * <p>
     * This is not recency based: a page that was just read can be dropped ahead
     * of an older page with a higher index.
     */
    LOWEST_INDEX {
        @Override
        public <V> Map<Integer, V> createPageMap() {
            return new TreeMap<>();
        }
    },

    /**
     * Drop the page that was read least recently. Iteration order is access order.
     */
    LEAST_RECENTLY_USED {
        @Override
        public <V> Map<Integer, V> createPageMap() {
            return new LinkedHashMap<>(16, 0.75f, true);
        }
    };

    /**
     * Create an empty map whose iteration order starts with the next eviction victim.
     *
     * @param <V> the cached value type
     * @return a new mutable map
     */
    public abstract <V> Map<Integer, V> createPageMap();
}
