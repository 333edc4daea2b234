package io.lazytable.storage;

import io.lazytable.core.EvictionPolicy;
import io.lazytable.kernel.LogicalTable;
import io.lazytable.kernel.selection.RowSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded cache of materialized pages for one logical table.
 * <p>
 * Pages are built on first access and kept until evicted or until the cache is
 * invalidated. Failed builds are never cached, so a page that failed is attempted
 * again on its next access.
 * <p>
 * <b>Thread-safety:</b> not thread-safe. The owner serializes every call, including
 * {@link #bind(LogicalTable, int)} and {@link #invalidate()}.
 */
public final class PageCache {

    private static final Logger LOG = LoggerFactory.getLogger(PageCache.class);

    private final PageBuilder builder;
    private final int capacity;
    private final EvictionPolicy evictionPolicy;
    private final Map<Integer, Page> pages;

    private LogicalTable table = LogicalTable.empty();
    private int pageSize;
    private long materializedPageCount;

    public PageCache(PageBuilder builder, int pageSize, int capacity, EvictionPolicy evictionPolicy) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        checkPageSize(pageSize);
        this.capacity = capacity;
        this.pageSize = pageSize;
        this.pages = evictionPolicy.createPageMap();
    }

    /**
     * Point the cache at a table and page size. Always invalidates.
     */
    public void bind(LogicalTable table, int pageSize) {
        Objects.requireNonNull(table, "table");
        checkPageSize(pageSize);
        this.table = table;
        this.pageSize = pageSize;
        invalidate();
    }

    /**
     * Get a page, building it on a miss.
     *
     * @param pageIndex page to fetch
     * @return the page, or the reason it could not be built
     * @throws IndexOutOfBoundsException if the page does not exist in the bound table
     */
    public PageResult getPage(int pageIndex) {
        int pageCount = table.pageCount(pageSize);
        if (pageIndex < 0 || pageIndex >= pageCount) {
            throw new IndexOutOfBoundsException("page out of range: " + pageIndex + " (page count " + pageCount + ")");
        }
        Page cached = pages.get(pageIndex);
        if (cached != null) {
            return new PageResult.Built(cached);
        }

        int start = pageIndex * pageSize;
        int count = Math.min(pageSize, table.totalRows() - start);
        RowSelector window = table.selector().slice(start, count);
        PageResult result = builder.build(pageIndex, start, window, table.columnSpecs());
        if (result instanceof PageResult.Built built) {
            materializedPageCount++;
            pages.put(pageIndex, built.page());
            evictOverflow();
        }
        return result;
    }

    /**
     * Drop every cached page.
     */
    public void invalidate() {
        if (!pages.isEmpty()) {
            LOG.debug("Invalidating {} cached pages", pages.size());
        }
        pages.clear();
    }

    private void evictOverflow() {
        while (pages.size() > capacity) {
            Integer victim = pages.keySet().iterator().next();
            pages.remove(victim);
            LOG.trace("Evicted page {} ({})", victim, evictionPolicy);
        }
    }

    private static void checkPageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
    }

    public boolean contains(int pageIndex) {
        return pages.containsKey(pageIndex);
    }

    public int size() {
        return pages.size();
    }

    public int capacity() {
        return capacity;
    }

    public int pageSize() {
        return pageSize;
    }

    public EvictionPolicy evictionPolicy() {
        return evictionPolicy;
    }

    public LogicalTable table() {
        return table;
    }

    /**
     * Cached page indices, next eviction victim first.
     */
    public List<Integer> cachedPageIndices() {
        return new ArrayList<>(pages.keySet());
    }

    /**
     * Number of successful page builds since this cache was created.
     */
    public long materializedPageCount() {
        return materializedPageCount;
    }
}
