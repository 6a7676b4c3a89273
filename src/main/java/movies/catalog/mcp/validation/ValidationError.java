package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * One violation found while checking a tool call. Plain value; never thrown.
 */
public class ValidationError {

    private final String field;
    private final String value;
    private final String message;
    private final String code;

    public ValidationError(String field, String value, String message, String code) {
        this.field = field;
        this.value = value;
        this.message = message;
        this.code = code;
    }

    public String getField() {
        return field;
    }

    /**
     * The offending value rendered as text; empty for missing fields.
     */
    public String getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return code;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("field", field)
            .put("value", value)
            .put("message", message)
            .put("code", code);
    }

    public static ValidationError fromJson(JsonObject json) {
        return new ValidationError(
            json.getString("field"),
            json.getString("value", ""),
            json.getString("message"),
            json.getString("code")
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return Objects.equals(field, that.field)
            && Objects.equals(value, that.value)
            && Objects.equals(message, that.message)
            && Objects.equals(code, that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value, message, code);
    }

    @Override
    public String toString() {
        return "ValidationError{field='" + field + "', code='" + code + "', value='" + value + "'}";
    }
}
