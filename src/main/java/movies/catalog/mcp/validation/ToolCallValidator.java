package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import movies.catalog.mcp.base.MCPTool;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks tool calls against the input schemas of a fixed set of tools.
 *
 * <p>Every violation is reported, not just the first. The validator holds no mutable state
 * after construction, so one instance can be shared by any number of concurrent callers.
 * It knows nothing about what the tools do; it answers purely from the schemas.</p>
 */
public class ToolCallValidator {

    public static final String TOOL_NAME_FIELD = "tool_name";

    private final Map<String, MCPTool> tools;
    private final Map<String, CallSchema> schemas;

    public ToolCallValidator(Collection<MCPTool> toolDefinitions) {
        Map<String, MCPTool> toolMap = new LinkedHashMap<>();
        Map<String, CallSchema> schemaMap = new LinkedHashMap<>();
        for (MCPTool tool : toolDefinitions) {
            toolMap.put(tool.getName(), tool);
            schemaMap.put(tool.getName(), CallSchema.fromInputSchema(tool.getInputSchema()));
        }
        this.tools = Collections.unmodifiableMap(toolMap);
        this.schemas = Collections.unmodifiableMap(schemaMap);
    }

    /**
     * All tool definitions this validator knows, in registration order.
     */
    public List<MCPTool> getSchemas() {
        return new ArrayList<>(tools.values());
    }

    public boolean hasTool(String toolName) {
        return schemas.containsKey(toolName);
    }

    /**
     * Validate a call of {@code toolName} with the given argument bag.
     */
    public ValidationResult validate(String toolName, JsonObject arguments) {
        CallSchema schema = toolName != null ? schemas.get(toolName) : null;
        if (schema == null) {
            return new ValidationResult(List.of(new ValidationError(
                TOOL_NAME_FIELD,
                String.valueOf(toolName),
                "Unknown tool: " + toolName,
                ValidationCodes.UNKNOWN_TOOL)));
        }

        JsonObject args = arguments != null ? arguments : new JsonObject();
        List<ValidationError> errors = new ArrayList<>();

        for (String required : schema.getRequiredFields()) {
            if (!args.containsKey(required)) {
                errors.add(new ValidationError(required, "",
                    "Required field '" + required + "' is missing",
                    ValidationCodes.REQUIRED_FIELD_MISSING));
            }
        }

        for (Map.Entry<String, Object> entry : args) {
            String fieldName = entry.getKey();
            FieldSchema fieldSchema = schema.getProperty(fieldName);
            if (fieldSchema == null) {
                errors.add(new ValidationError(fieldName, describe(entry.getValue()),
                    "Unknown field '" + fieldName + "'",
                    ValidationCodes.UNKNOWN_FIELD));
                continue;
            }
            validateField(fieldName, entry.getValue(), fieldSchema, errors);
        }

        return new ValidationResult(errors);
    }

    /**
     * Single dispatch point over the field kind. Containers call back into this method for
     * their elements, so nesting depth is bounded only by the schema.
     */
    void validateField(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        switch (schema.getKind()) {
            case STRING:
                validateString(fieldName, value, schema, errors);
                break;
            case INTEGER:
                validateInteger(fieldName, value, schema, errors);
                break;
            case NUMBER:
                validateNumber(fieldName, value, schema, errors);
                break;
            case BOOLEAN:
                validateBoolean(fieldName, value, errors);
                break;
            case ARRAY:
                validateArray(fieldName, value, schema, errors);
                break;
            case OBJECT:
                validateObject(fieldName, value, schema, errors);
                break;
            default:
                String declared = schema.getDeclaredType();
                errors.add(new ValidationError(fieldName, describe(value),
                    declared == null
                        ? "Field schema missing type"
                        : "Unsupported field type: " + declared,
                    ValidationCodes.UNSUPPORTED_TYPE));
        }
    }

    private void validateString(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        if (!(value instanceof String)) {
            errors.add(typeMismatch(fieldName, "string", value));
            return;
        }
        String str = (String) value;

        List<String> enumValues = schema.getEnumValues();
        if (enumValues != null && !enumValues.contains(str)) {
            errors.add(new ValidationError(fieldName, str,
                "Value must be one of: " + String.join(", ", enumValues),
                ValidationCodes.INVALID_ENUM_VALUE));
        }

        int length = str.codePointCount(0, str.length());
        if (schema.getMinLength() != null && length < schema.getMinLength()) {
            errors.add(new ValidationError(fieldName, str,
                "String length must be at least " + schema.getMinLength() + " characters",
                ValidationCodes.STRING_TOO_SHORT));
        }
        if (schema.getMaxLength() != null && length > schema.getMaxLength()) {
            errors.add(new ValidationError(fieldName, str,
                "String length must be at most " + schema.getMaxLength() + " characters",
                ValidationCodes.STRING_TOO_LONG));
        }

        String format = schema.getFormat();
        if (("date".equals(format) || schema.hasDatePattern()) && !isValidDateFormat(str)) {
            errors.add(new ValidationError(fieldName, str,
                "Invalid date format, expected YYYY-MM-DD",
                ValidationCodes.INVALID_DATE_FORMAT));
        }
        if ("uri".equals(format) && !isValidUri(str)) {
            errors.add(new ValidationError(fieldName, str,
                "Invalid URI format",
                ValidationCodes.INVALID_URI_FORMAT));
        }
    }

    private void validateInteger(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        if (!(value instanceof Number)) {
            errors.add(typeMismatch(fieldName, "integer", value));
            return;
        }
        Number number = (Number) value;
        if (hasFraction(number)) {
            errors.add(new ValidationError(fieldName, describe(value),
                "Expected integer, got decimal number",
                ValidationCodes.NOT_INTEGER));
            return;
        }
        checkBounds(fieldName, number, schema, errors);
    }

    private void validateNumber(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        if (!(value instanceof Number)) {
            errors.add(typeMismatch(fieldName, "number", value));
            return;
        }
        checkBounds(fieldName, (Number) value, schema, errors);
    }

    private void checkBounds(String fieldName, Number number, FieldSchema schema, List<ValidationError> errors) {
        double numeric = number.doubleValue();
        if (schema.getMinimum() != null && numeric < schema.getMinimum()) {
            errors.add(new ValidationError(fieldName, formatNumber(numeric),
                "Value must be at least " + formatNumber(schema.getMinimum()),
                ValidationCodes.VALUE_TOO_SMALL));
        }
        if (schema.getMaximum() != null && numeric > schema.getMaximum()) {
            errors.add(new ValidationError(fieldName, formatNumber(numeric),
                "Value must be at most " + formatNumber(schema.getMaximum()),
                ValidationCodes.VALUE_TOO_LARGE));
        }
    }

    private void validateBoolean(String fieldName, Object value, List<ValidationError> errors) {
        if (!(value instanceof Boolean)) {
            errors.add(typeMismatch(fieldName, "boolean", value));
        }
    }

    private void validateArray(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        if (!(value instanceof JsonArray)) {
            errors.add(typeMismatch(fieldName, "array", value));
            return;
        }
        JsonArray array = (JsonArray) value;
        int size = array.size();

        if (schema.getMinItems() != null && size < schema.getMinItems()) {
            errors.add(new ValidationError(fieldName, "array with " + size + " items",
                "Array must have at least " + schema.getMinItems() + " items",
                ValidationCodes.ARRAY_TOO_SHORT));
        }
        if (schema.getMaxItems() != null && size > schema.getMaxItems()) {
            errors.add(new ValidationError(fieldName, "array with " + size + " items",
                "Array must have at most " + schema.getMaxItems() + " items",
                ValidationCodes.ARRAY_TOO_LONG));
        }

        FieldSchema itemSchema = schema.getItems();
        if (itemSchema != null) {
            for (int i = 0; i < size; i++) {
                validateField(itemPath(fieldName, i), array.getValue(i), itemSchema, errors);
            }
        }
    }

    private void validateObject(String fieldName, Object value, FieldSchema schema, List<ValidationError> errors) {
        if (!(value instanceof JsonObject)) {
            errors.add(typeMismatch(fieldName, "object", value));
            return;
        }
        JsonObject object = (JsonObject) value;

        // undeclared sub-properties are allowed
        for (Map.Entry<String, Object> entry : object) {
            FieldSchema propertySchema = schema.getProperties().get(entry.getKey());
            if (propertySchema != null) {
                validateField(propertyPath(fieldName, entry.getKey()), entry.getValue(), propertySchema, errors);
            }
        }

        for (String required : schema.getRequired()) {
            if (!object.containsKey(required)) {
                errors.add(new ValidationError(propertyPath(fieldName, required), "",
                    "Required property '" + required + "' is missing",
                    ValidationCodes.REQUIRED_PROPERTY_MISSING));
            }
        }
    }

    static String itemPath(String fieldName, int index) {
        return fieldName + "[" + index + "]";
    }

    static String propertyPath(String fieldName, String property) {
        return fieldName + "." + property;
    }

    /**
     * YYYY-MM-DD with numeric parts, year 1000-9999, month 1-12, day 1-31.
     * No calendar check (2023-02-31 passes).
     */
    static boolean isValidDateFormat(String date) {
        if (date.length() != 10) {
            return false;
        }
        String[] parts = date.split("-", -1);
        if (parts.length != 3 || !allDigits(parts[0]) || !allDigits(parts[1]) || !allDigits(parts[2])) {
            return false;
        }
        int year = Integer.parseInt(parts[0]);
        int month = Integer.parseInt(parts[1]);
        int day = Integer.parseInt(parts[2]);
        return year >= 1000 && year <= 9999
            && month >= 1 && month <= 12
            && day >= 1 && day <= 31;
    }

    static boolean isValidUri(String uri) {
        if (uri.isEmpty()) {
            return false;
        }
        return uri.contains("://") || uri.startsWith("/") || uri.startsWith("mailto:");
    }

    private static boolean allDigits(String part) {
        if (part.isEmpty()) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean hasFraction(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isNaN(d) || d != Math.rint(d);
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).stripTrailingZeros().scale() > 0;
        }
        return false;
    }

    private static ValidationError typeMismatch(String fieldName, String expected, Object value) {
        return new ValidationError(fieldName, describe(value),
            "Expected " + expected + ", got " + typeName(value),
            ValidationCodes.TYPE_MISMATCH);
    }

    static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        if (value instanceof JsonArray) return "array";
        if (value instanceof JsonObject) return "object";
        return value.getClass().getSimpleName();
    }

    static String describe(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).encode();
        }
        if (value instanceof JsonArray) {
            return ((JsonArray) value).encode();
        }
        return String.valueOf(value);
    }

    static String formatNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
