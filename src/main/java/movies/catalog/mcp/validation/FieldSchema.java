package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared shape of a single tool argument, parsed from a JSON Schema fragment.
 *
 * <p>Only the constraints that belong to the field's kind are read; everything else in the
 * fragment (descriptions, defaults) is ignored by validation. Instances are immutable and
 * nested schemas (array items, object properties) are parsed eagerly.</p>
 */
public class FieldSchema {

    static final String DATE_PATTERN = "^\\d{4}-\\d{2}-\\d{2}$";

    private final FieldKind kind;
    private final String declaredType;

    // string
    private final Integer minLength;
    private final Integer maxLength;
    private final List<String> enumValues;
    private final String format;
    private final boolean datePattern;

    // integer / number
    private final Double minimum;
    private final Double maximum;

    // array
    private final Integer minItems;
    private final Integer maxItems;
    private final FieldSchema items;

    // object
    private final Map<String, FieldSchema> properties;
    private final List<String> required;

    private FieldSchema(FieldKind kind, String declaredType, JsonObject json) {
        this.kind = kind;
        this.declaredType = declaredType;
        this.minLength = kind == FieldKind.STRING ? intOrNull(json, "minLength") : null;
        this.maxLength = kind == FieldKind.STRING ? intOrNull(json, "maxLength") : null;
        this.enumValues = kind == FieldKind.STRING ? stringListOrNull(json.getValue("enum")) : null;
        this.format = kind == FieldKind.STRING ? stringOrNull(json, "format") : null;
        // the date regex is the only pattern that gets checked
        this.datePattern = kind == FieldKind.STRING && DATE_PATTERN.equals(json.getValue("pattern"));
        boolean numeric = kind == FieldKind.INTEGER || kind == FieldKind.NUMBER;
        this.minimum = numeric ? doubleOrNull(json, "minimum") : null;
        this.maximum = numeric ? doubleOrNull(json, "maximum") : null;
        this.minItems = kind == FieldKind.ARRAY ? intOrNull(json, "minItems") : null;
        this.maxItems = kind == FieldKind.ARRAY ? intOrNull(json, "maxItems") : null;
        Object itemsValue = json.getValue("items");
        this.items = kind == FieldKind.ARRAY && itemsValue instanceof JsonObject
            ? fromJson((JsonObject) itemsValue)
            : null;
        this.properties = kind == FieldKind.OBJECT ? parseProperties(json.getValue("properties")) : Collections.emptyMap();
        List<String> requiredList = kind == FieldKind.OBJECT ? stringListOrNull(json.getValue("required")) : null;
        this.required = requiredList != null ? requiredList : Collections.emptyList();
    }

    /**
     * Parse a JSON Schema fragment such as {@code {"type":"integer","minimum":1}}.
     * A fragment without a recognised "type" yields an {@link FieldKind#UNSUPPORTED} schema.
     */
    public static FieldSchema fromJson(JsonObject json) {
        if (json == null) {
            return new FieldSchema(FieldKind.UNSUPPORTED, null, new JsonObject());
        }
        Object type = json.getValue("type");
        String declaredType = type instanceof String ? (String) type : null;
        return new FieldSchema(FieldKind.fromJsonSchemaType(declaredType), declaredType, json);
    }

    /**
     * Parse a "properties" object into an ordered name to schema map.
     * Non-object property fragments parse as unsupported schemas.
     */
    static Map<String, FieldSchema> parseProperties(Object value) {
        if (!(value instanceof JsonObject)) {
            return Collections.emptyMap();
        }
        Map<String, FieldSchema> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : (JsonObject) value) {
            Object fragment = entry.getValue();
            parsed.put(entry.getKey(), fromJson(fragment instanceof JsonObject ? (JsonObject) fragment : null));
        }
        return Collections.unmodifiableMap(parsed);
    }

    static List<String> stringListOrNull(Object value) {
        if (!(value instanceof JsonArray)) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (Object item : (JsonArray) value) {
            if (item instanceof String) {
                values.add((String) item);
            }
        }
        return Collections.unmodifiableList(values);
    }

    private static String stringOrNull(JsonObject json, String key) {
        Object value = json.getValue(key);
        return value instanceof String ? (String) value : null;
    }

    private static Integer intOrNull(JsonObject json, String key) {
        Object value = json.getValue(key);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    private static Double doubleOrNull(JsonObject json, String key) {
        Object value = json.getValue(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    public FieldKind getKind() {
        return kind;
    }

    /**
     * The raw "type" string from the schema, or null when the schema had none.
     */
    public String getDeclaredType() {
        return declaredType;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public List<String> getEnumValues() {
        return enumValues;
    }

    public String getFormat() {
        return format;
    }

    /**
     * True when the fragment's "pattern" is the YYYY-MM-DD regex. Checked independently of
     * {@link #getFormat()}.
     */
    public boolean hasDatePattern() {
        return datePattern;
    }

    public Double getMinimum() {
        return minimum;
    }

    public Double getMaximum() {
        return maximum;
    }

    public Integer getMinItems() {
        return minItems;
    }

    public Integer getMaxItems() {
        return maxItems;
    }

    public FieldSchema getItems() {
        return items;
    }

    public Map<String, FieldSchema> getProperties() {
        return properties;
    }

    public List<String> getRequired() {
        return required;
    }

    @Override
    public String toString() {
        return "FieldSchema{kind=" + kind + ", declaredType='" + declaredType + "'}";
    }
}
