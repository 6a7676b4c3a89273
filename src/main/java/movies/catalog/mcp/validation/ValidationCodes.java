package movies.catalog.mcp.validation;

/**
 * Closed set of codes a {@link ValidationError} can carry.
 */
public final class ValidationCodes {

    public static final String UNKNOWN_TOOL = "UNKNOWN_TOOL";
    public static final String REQUIRED_FIELD_MISSING = "REQUIRED_FIELD_MISSING";
    public static final String UNKNOWN_FIELD = "UNKNOWN_FIELD";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String UNSUPPORTED_TYPE = "UNSUPPORTED_TYPE";

    public static final String INVALID_ENUM_VALUE = "INVALID_ENUM_VALUE";
    public static final String STRING_TOO_SHORT = "STRING_TOO_SHORT";
    public static final String STRING_TOO_LONG = "STRING_TOO_LONG";
    public static final String INVALID_DATE_FORMAT = "INVALID_DATE_FORMAT";
    public static final String INVALID_URI_FORMAT = "INVALID_URI_FORMAT";

    public static final String NOT_INTEGER = "NOT_INTEGER";
    public static final String VALUE_TOO_SMALL = "VALUE_TOO_SMALL";
    public static final String VALUE_TOO_LARGE = "VALUE_TOO_LARGE";

    public static final String ARRAY_TOO_SHORT = "ARRAY_TOO_SHORT";
    public static final String ARRAY_TOO_LONG = "ARRAY_TOO_LONG";

    public static final String REQUIRED_PROPERTY_MISSING = "REQUIRED_PROPERTY_MISSING";

    private ValidationCodes() {
    }
}
