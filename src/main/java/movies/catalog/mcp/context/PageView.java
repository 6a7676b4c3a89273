package movies.catalog.mcp.context;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * One page of a result context, computed fresh for every request.
 */
public class PageView {

    private final String contextId;
    private final List<Object> data;
    private final int page;
    private final int pageSize;
    private final int total;
    private final int totalPages;

    PageView(String contextId, List<Object> data, int page, int pageSize, int total, int totalPages) {
        this.contextId = contextId;
        this.data = data;
        this.page = page;
        this.pageSize = pageSize;
        this.total = total;
        this.totalPages = totalPages;
    }

    public String getContextId() {
        return contextId;
    }

    public List<Object> getData() {
        return data;
    }

    /**
     * The page actually served, after clamping the requested number.
     */
    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getTotal() {
        return total;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean hasNext() {
        return page < totalPages;
    }

    public boolean hasPrevious() {
        return page > 1;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("contextId", contextId)
            .put("data", new JsonArray(data))
            .put("page", page)
            .put("pageSize", pageSize)
            .put("total", total)
            .put("totalPages", totalPages)
            .put("hasNext", hasNext())
            .put("hasPrevious", hasPrevious());
    }

    @Override
    public String toString() {
        return "PageView{contextId='" + contextId + "', page=" + page + "/" + totalPages +
            ", items=" + data.size() + "}";
    }
}
