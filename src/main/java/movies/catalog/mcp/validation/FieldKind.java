package movies.catalog.mcp.validation;

/**
 * The value kinds a tool argument can be declared as.
 * UNSUPPORTED covers a missing or unrecognised "type" in the schema.
 */
public enum FieldKind {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    UNSUPPORTED(null);

    private final String jsonSchemaType;

    FieldKind(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    /**
     * Resolve the kind named by a JSON Schema "type" string.
     */
    public static FieldKind fromJsonSchemaType(String type) {
        if (type == null) {
            return UNSUPPORTED;
        }
        for (FieldKind kind : values()) {
            if (type.equals(kind.jsonSchemaType)) {
                return kind;
            }
        }
        return UNSUPPORTED;
    }
}
