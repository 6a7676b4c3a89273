package movies.catalog.mcp.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Holds computed result sequences so clients can page through them across several calls
 * without the query being run again.
 *
 * <p>Every context lives for a fixed TTL from creation. Expired contexts are removed lazily
 * when touched and in bulk by {@link #removeExpired()}; either way an expired id behaves
 * exactly like one that was never issued. All access to the table goes through one monitor,
 * so concurrent creates, reads of the same context and sweeps are safe.</p>
 *
 * <p>Page sizes and page numbers are normalised rather than rejected: a non-positive page
 * size falls back to the default, an oversized one is capped, and page numbers are clamped
 * into {@code [1, totalPages]}.</p>
 */
public class ResultContextManager {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 1000;

    private final Map<String, ResultContext> contexts = new HashMap<>();
    private final Clock clock;
    private final Supplier<String> idSupplier;
    private final Duration ttl;
    private final int defaultPageSize;
    private final int maxPageSize;

    public ResultContextManager() {
        this(DEFAULT_TTL, DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
    }

    public ResultContextManager(Duration ttl, int defaultPageSize, int maxPageSize) {
        this(Clock.systemUTC(), ResultContextManager::generateContextId, ttl, defaultPageSize, maxPageSize);
    }

    public ResultContextManager(Clock clock, Supplier<String> idSupplier, Duration ttl,
                                int defaultPageSize, int maxPageSize) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Context TTL must be positive: " + ttl);
        }
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("Invalid page size bounds: default=" + defaultPageSize + ", max=" + maxPageSize);
        }
        this.clock = clock;
        this.idSupplier = idSupplier;
        this.ttl = ttl;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public ContextInfo createContext(List<?> results, int pageSize) {
        return createContext(results, null, pageSize);
    }

    /**
     * Store a result sequence and return its metadata.
     *
     * @param results  the full, already computed sequence; copied on the way in
     * @param query    opaque description of what produced the results, kept for reference
     * @param pageSize requested page size; normalised into the configured bounds
     */
    public ContextInfo createContext(List<?> results, Object query, int pageSize) {
        List<?> data = results != null ? results : List.of();
        int effectivePageSize = normalisePageSize(pageSize);
        Instant now = clock.instant();

        synchronized (contexts) {
            String id = idSupplier.get();
            while (contexts.containsKey(id)) {
                id = idSupplier.get();
            }
            ResultContext context = new ResultContext(id, data, query, effectivePageSize, now, now.plus(ttl));
            contexts.put(id, context);
            return context.toInfo();
        }
    }

    public PageView getPage(String contextId, int pageNumber) {
        return getPage(contextId, pageNumber, 0);
    }

    /**
     * Serve one page. {@code pageSizeOverride} replaces the stored page size for this request
     * when it lies in {@code (0, max]}; any other value keeps the stored size.
     *
     * @throws ContextNotFoundException if the id is unknown or the context has expired
     */
    public PageView getPage(String contextId, int pageNumber, int pageSizeOverride) {
        ResultContext context = lookup(contextId);

        int pageSize = context.pageSize;
        if (pageSizeOverride > 0 && pageSizeOverride <= maxPageSize) {
            pageSize = pageSizeOverride;
        }

        int total = context.total();
        int totalPages = totalPages(total, pageSize);
        int page = Math.max(1, Math.min(pageNumber, totalPages));

        int from = Math.min((page - 1) * pageSize, total);
        int to = Math.min(page * pageSize, total);
        List<Object> slice = context.data.subList(from, to);

        return new PageView(context.id, slice, page, pageSize, total, totalPages);
    }

    /**
     * @throws ContextNotFoundException if the id is unknown or the context has expired
     */
    public ContextInfo getContextInfo(String contextId) {
        return lookup(contextId).toInfo();
    }

    /**
     * Drop a context before its TTL runs out.
     *
     * @return true if a live context was removed
     */
    public boolean deleteContext(String contextId) {
        Instant now = clock.instant();
        synchronized (contexts) {
            ResultContext removed = contexts.remove(contextId);
            return removed != null && !removed.isExpired(now);
        }
    }

    /**
     * Remove every expired context.
     *
     * @return how many were removed
     */
    public int removeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (contexts) {
            Iterator<ResultContext> it = contexts.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int activeContextCount() {
        Instant now = clock.instant();
        synchronized (contexts) {
            int count = 0;
            for (ResultContext context : contexts.values()) {
                if (!context.isExpired(now)) {
                    count++;
                }
            }
            return count;
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    int normalisePageSize(int requested) {
        if (requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private ResultContext lookup(String contextId) {
        if (contextId == null) {
            throw new ContextNotFoundException(null);
        }
        Instant now = clock.instant();
        synchronized (contexts) {
            ResultContext context = contexts.get(contextId);
            if (context == null) {
                throw new ContextNotFoundException(contextId);
            }
            if (context.isExpired(now)) {
                contexts.remove(contextId);
                throw new ContextNotFoundException(contextId);
            }
            return context;
        }
    }

    static int totalPages(int total, int pageSize) {
        if (total == 0) {
            return 0;
        }
        return (total + pageSize - 1) / pageSize;
    }

    static String generateContextId() {
        return "ctx_" + UUID.randomUUID().toString().replace("-", "");
    }
}
