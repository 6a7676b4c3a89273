package movies.catalog.mcp.context;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stored result sequence with its paging and lifetime metadata.
 * Only the manager's table holds references to these.
 */
class ResultContext {

    final String id;
    final List<Object> data;
    final Object query;
    final int pageSize;
    final Instant createdAt;
    final Instant expiresAt;

    ResultContext(String id, List<?> data, Object query, int pageSize, Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.data = Collections.unmodifiableList(new ArrayList<>(data));
        this.query = query;
        this.pageSize = pageSize;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    int total() {
        return data.size();
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    ContextInfo toInfo() {
        return new ContextInfo(id, total(), pageSize, ResultContextManager.totalPages(total(), pageSize), createdAt, expiresAt, query);
    }
}
