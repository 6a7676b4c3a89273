package movies.catalog.mcp.context;

/**
 * The only failure of the context manager: the id was never issued, was deleted, or has
 * expired. The three cases are deliberately indistinguishable.
 */
public class ContextNotFoundException extends RuntimeException {

    private final String contextId;

    public ContextNotFoundException(String contextId) {
        super("Context not found or expired: " + contextId);
        this.contextId = contextId;
    }

    public String getContextId() {
        return contextId;
    }
}
