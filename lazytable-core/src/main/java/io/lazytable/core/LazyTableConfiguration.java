package io.lazytable.core;

import java.util.Objects;

/**
 * Immutable configuration for a paged table accessor.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * LazyTableConfiguration config = LazyTableConfiguration.builder()
 *     .pageSize(256)
 *     .cacheCapacity(20)
 *     .evictionPolicy(EvictionPolicy.LEAST_RECENTLY_USED)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.lazytable.runtime.TableAccessor
 */
public final class LazyTableConfiguration {

    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int DEFAULT_CACHE_CAPACITY = 10;

    private static final LazyTableConfiguration DEFAULTS = builder().build();

    // Windowing
    private final int pageSize;

    // Page cache
    private final int cacheCapacity;
    private final EvictionPolicy evictionPolicy;

    private LazyTableConfiguration(Builder builder) {
        this.pageSize = builder.pageSize;
        this.cacheCapacity = builder.cacheCapacity;
        this.evictionPolicy = builder.evictionPolicy;
    }

    /**
     * Create a new builder for LazyTableConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration with every setting at its default value.
     */
    public static LazyTableConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the initial number of rows materialized per page.
     *
     * @return page size (number of rows per page)
     */
    public int pageSize() {
        return pageSize;
    }

    /**
     * Get the maximum number of pages held by the page cache.
     *
     * @return cache capacity in pages
     */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    /**
     * Get the policy used to drop pages once the cache is full.
     *
     * @return the eviction policy (default: LOWEST_INDEX)
     */
    public EvictionPolicy evictionPolicy() {
        return evictionPolicy;
    }

    @Override
    public String toString() {
        return "LazyTableConfiguration[pageSize=" + pageSize
                + ", cacheCapacity=" + cacheCapacity
                + ", evictionPolicy=" + evictionPolicy + "]";
    }

    /**
     * Builder for LazyTableConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private EvictionPolicy evictionPolicy = EvictionPolicy.LOWEST_INDEX;

        private Builder() {
        }

        /**
         * Set the number of rows per page.
         *
         * @param pageSize the page size (must be positive)
         * @return this builder for method chaining
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Set the maximum number of cached pages.
         *
         * @param cacheCapacity the capacity (must be positive)
         * @return this builder for method chaining
         */
        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        /**
         * Set the eviction policy.
         *
         * @param evictionPolicy the policy
         * @return this builder for method chaining
         */
        public Builder evictionPolicy(EvictionPolicy evictionPolicy) {
            this.evictionPolicy = evictionPolicy;
            return this;
        }

        /**
         * Build the immutable LazyTableConfiguration.
         *
         * @return a new LazyTableConfiguration instance
         * @throws IllegalArgumentException if a size is not positive
         */
        public LazyTableConfiguration build() {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            }
            if (cacheCapacity <= 0) {
                throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
            }
            Objects.requireNonNull(evictionPolicy, "evictionPolicy");
            return new LazyTableConfiguration(this);
        }
    }
}
