package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accepted arguments of one tool: the required names and the declared properties.
 */
public class CallSchema {

    private final Set<String> requiredFields;
    private final Map<String, FieldSchema> properties;

    public CallSchema(Set<String> requiredFields, Map<String, FieldSchema> properties) {
        this.requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
        this.properties = properties;
    }

    /**
     * Build from a tool's MCP input schema,
     * e.g. {@code {"type":"object","properties":{...},"required":[...]}}.
     */
    public static CallSchema fromInputSchema(JsonObject inputSchema) {
        if (inputSchema == null) {
            return new CallSchema(Collections.emptySet(), Collections.emptyMap());
        }
        List<String> required = FieldSchema.stringListOrNull(inputSchema.getValue("required"));
        return new CallSchema(
            required != null ? new LinkedHashSet<>(required) : Collections.emptySet(),
            FieldSchema.parseProperties(inputSchema.getValue("properties"))
        );
    }

    public Set<String> getRequiredFields() {
        return requiredFields;
    }

    public Map<String, FieldSchema> getProperties() {
        return properties;
    }

    public FieldSchema getProperty(String name) {
        return properties.get(name);
    }
}
