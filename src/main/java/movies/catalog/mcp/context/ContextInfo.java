package movies.catalog.mcp.context;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Metadata of a result context. Never carries the data itself.
 */
public class ContextInfo {

    private final String id;
    private final int total;
    private final int pageSize;
    private final int totalPages;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Object query;

    public ContextInfo(String id, int total, int pageSize, int totalPages, Instant createdAt, Instant expiresAt,
                       Object query) {
        this.id = id;
        this.total = total;
        this.pageSize = pageSize;
        this.totalPages = totalPages;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.query = query;
    }

    public String getId() {
        return id;
    }

    public int getTotal() {
        return total;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Description of what produced the results, as given at creation; may be null.
     */
    public Object getQuery() {
        return query;
    }

    /**
     * Timestamps are ISO-8601 UTC instants so they sort as text.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("id", id)
            .put("total", total)
            .put("pageSize", pageSize)
            .put("totalPages", totalPages)
            .put("createdAt", DateTimeFormatter.ISO_INSTANT.format(createdAt))
            .put("expiresAt", DateTimeFormatter.ISO_INSTANT.format(expiresAt));
        if (query != null) {
            json.put("query", query);
        }
        return json;
    }

    @Override
    public String toString() {
        return "ContextInfo{id='" + id + "', total=" + total + ", pageSize=" + pageSize +
            ", totalPages=" + totalPages + ", expiresAt=" + expiresAt + "}";
    }
}
