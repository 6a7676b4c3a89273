package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import movies.catalog.mcp.base.MCPTool;
import movies.catalog.mcp.schemas.CatalogToolSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation of tool calls against the catalog schemas and a few ad-hoc schemas.
 */
public class ToolCallValidatorTest {

    private ToolCallValidator validator;

    @BeforeEach
    void setUp() {
        List<MCPTool> tools = new ArrayList<>(CatalogToolSchemas.allTools());
        tools.add(new MCPTool("sampler", "Schema covering every keyword",
            new JsonObject()
                .put("type", "object")
                .put("properties", new JsonObject()
                    .put("count", new JsonObject().put("type", "integer").put("minimum", 1).put("maximum", 10))
                    .put("mode", new JsonObject().put("type", "string").put("enum", new JsonArray().add("fast").add("slow")))
                    .put("code", new JsonObject().put("type", "string").put("minLength", 3).put("maxLength", 3))
                    .put("day", new JsonObject().put("type", "string").put("pattern", "^\\d{4}-\\d{2}-\\d{2}$"))
                    .put("link", new JsonObject().put("type", "string").put("format", "uri")
                        .put("pattern", "^\\d{4}-\\d{2}-\\d{2}$"))
                    .put("flag", new JsonObject().put("type", "boolean"))
                    .put("tags", new JsonObject().put("type", "array").put("maxItems", 2)
                        .put("items", new JsonObject().put("type", "string")))
                    .put("blob", new JsonObject().put("type", "tuple"))
                    .put("untyped", new JsonObject().put("description", "no type")))
                .put("required", new JsonArray())));
        validator = new ToolCallValidator(tools);
    }

    private static List<String> codes(ValidationResult result) {
        return result.getErrors().stream().map(ValidationError::getCode).collect(Collectors.toList());
    }

    private static List<String> fields(ValidationResult result) {
        return result.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList());
    }

    @Test
    @DisplayName("add_movie without title reports exactly the missing title")
    void testMissingRequiredTitle() {
        ValidationResult result = validator.validate("add_movie",
            new JsonObject().put("director", "X").put("year", 1999));

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ValidationCodes.REQUIRED_FIELD_MISSING, error.getCode());
        assertEquals("title", error.getField());
        assertEquals("", error.getValue());
    }

    @Test
    @DisplayName("Every missing required field is reported once")
    void testAllMissingRequiredFieldsReported() {
        ValidationResult result = validator.validate("add_movie", new JsonObject());

        assertEquals(List.of("title", "director", "year"), fields(result));
        assertTrue(codes(result).stream().allMatch(ValidationCodes.REQUIRED_FIELD_MISSING::equals));
    }

    @Test
    @DisplayName("Rating above ten is too large")
    void testRatingTooLarge() {
        ValidationResult result = validator.validate("add_movie", new JsonObject()
            .put("title", "Heat").put("director", "Michael Mann").put("year", 1995).put("rating", 11.0));

        assertFalse(result.isValid());
        assertEquals(List.of(ValidationCodes.VALUE_TOO_LARGE), codes(result));
        assertEquals("rating", result.getErrors().get(0).getField());
        assertEquals("11", result.getErrors().get(0).getValue());
    }

    @Test
    @DisplayName("Unknown tool yields a single error")
    void testUnknownTool() {
        ValidationResult result = validator.validate("frobnicate", new JsonObject().put("anything", 1));

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals(ValidationCodes.UNKNOWN_TOOL, result.getErrors().get(0).getCode());
        assertEquals("tool_name", result.getErrors().get(0).getField());
        assertEquals("frobnicate", result.getErrors().get(0).getValue());
    }

    @Test
    @DisplayName("A complete add_movie call is valid")
    void testValidCall() {
        ValidationResult result = validator.validate("add_movie", new JsonObject()
            .put("title", "Heat")
            .put("director", "Michael Mann")
            .put("year", 1995)
            .put("rating", 8.3)
            .put("genres", new JsonArray().add("Crime").add("Drama"))
            .put("poster_url", "https://example.org/heat.jpg"));

        assertTrue(result.isValid(), result.toString());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    @DisplayName("Undeclared argument is an unknown field")
    void testUnknownField() {
        ValidationResult result = validator.validate("get_movie",
            new JsonObject().put("movie_id", 1).put("extra", "x"));

        assertEquals(List.of(ValidationCodes.UNKNOWN_FIELD), codes(result));
        assertEquals("extra", result.getErrors().get(0).getField());
    }

    @Test
    @DisplayName("Integers accept whole decimals and reject fractions")
    void testIntegerFractions() {
        assertTrue(validator.validate("sampler", new JsonObject().put("count", 5)).isValid());
        assertTrue(validator.validate("sampler", new JsonObject().put("count", 5.0)).isValid());

        ValidationResult fraction = validator.validate("sampler", new JsonObject().put("count", 5.5));
        assertEquals(List.of(ValidationCodes.NOT_INTEGER), codes(fraction));
    }

    @Test
    @DisplayName("Integer bounds")
    void testIntegerBounds() {
        assertEquals(List.of(ValidationCodes.VALUE_TOO_SMALL),
            codes(validator.validate("sampler", new JsonObject().put("count", 0))));
        assertEquals(List.of(ValidationCodes.VALUE_TOO_LARGE),
            codes(validator.validate("sampler", new JsonObject().put("count", 11))));
        assertTrue(validator.validate("sampler", new JsonObject().put("count", 10)).isValid());
    }

    @Test
    @DisplayName("Type mismatches stop further checks on the value")
    void testTypeMismatch() {
        ValidationResult result = validator.validate("sampler", new JsonObject()
            .put("count", "five")
            .put("mode", 3)
            .put("flag", "true")
            .put("tags", "a"));

        assertEquals(4, result.getErrors().size());
        assertTrue(codes(result).stream().allMatch(ValidationCodes.TYPE_MISMATCH::equals));
        assertEquals("Expected integer, got string", result.getErrors().get(0).getMessage());
    }

    @Test
    @DisplayName("Null is a type mismatch for every kind")
    void testNullValue() {
        ValidationResult result = validator.validate("sampler", new JsonObject()
            .putNull("count")
            .putNull("mode")
            .putNull("flag"));

        assertEquals(3, result.getErrors().size());
        assertTrue(codes(result).stream().allMatch(ValidationCodes.TYPE_MISMATCH::equals));
        assertEquals("null", result.getErrors().get(0).getValue());
    }

    @Test
    @DisplayName("Enum and length failures accumulate")
    void testStringConstraintsAccumulate() {
        ValidationResult result = validator.validate("sampler", new JsonObject()
            .put("mode", "medium")
            .put("code", "ab"));

        assertEquals(List.of(ValidationCodes.INVALID_ENUM_VALUE, ValidationCodes.STRING_TOO_SHORT), codes(result));
        assertEquals("Value must be one of: fast, slow", result.getErrors().get(0).getMessage());

        assertEquals(List.of(ValidationCodes.STRING_TOO_LONG),
            codes(validator.validate("sampler", new JsonObject().put("code", "abcd"))));
    }

    @Test
    @DisplayName("String length counts code points")
    void testCodePointLength() {
        // three emoji, six UTF-16 units
        String threeEmoji = "🎬🎬🎬";
        assertTrue(validator.validate("sampler", new JsonObject().put("code", threeEmoji)).isValid());
    }

    @Test
    @DisplayName("Date pattern is checked as a date")
    void testDatePattern() {
        assertTrue(validator.validate("sampler", new JsonObject().put("day", "2023-02-28")).isValid());
        // no calendar check
        assertTrue(validator.validate("sampler", new JsonObject().put("day", "2023-02-31")).isValid());

        for (String bad : List.of("2023-13-01", "0999-01-01", "2023-1-01", "2023/01/01", "20230101xx", "2023-01-00")) {
            assertEquals(List.of(ValidationCodes.INVALID_DATE_FORMAT),
                codes(validator.validate("sampler", new JsonObject().put("day", bad))), bad);
        }
    }

    @Test
    @DisplayName("Date pattern and uri format on one field are both checked")
    void testDatePatternWithUriFormat() {
        assertEquals(List.of(ValidationCodes.INVALID_DATE_FORMAT, ValidationCodes.INVALID_URI_FORMAT),
            codes(validator.validate("sampler", new JsonObject().put("link", "not a uri"))));
        assertEquals(List.of(ValidationCodes.INVALID_DATE_FORMAT),
            codes(validator.validate("sampler", new JsonObject().put("link", "http://example.com/p"))));
        assertTrue(validator.validate("sampler", new JsonObject().put("link", "2024-05-01")).isValid());
    }

    @Test
    @DisplayName("validate_tool_call rejects an empty tool name")
    void testEmptyToolName() {
        ValidationResult result = validator.validate("validate_tool_call",
            new JsonObject().put("tool_name", "").put("arguments", new JsonObject()));

        assertEquals(List.of(ValidationCodes.STRING_TOO_SHORT), codes(result));
        assertEquals(List.of("tool_name"), fields(result));
    }

    @Test
    @DisplayName("URI format")
    void testUriFormat() {
        JsonObject base = new JsonObject().put("title", "T").put("director", "D").put("year", 2000);

        assertTrue(validator.validate("add_movie", base.copy().put("poster_url", "/img/p.png")).isValid());
        assertTrue(validator.validate("add_movie", base.copy().put("poster_url", "mailto:a@b.c")).isValid());
        assertEquals(List.of(ValidationCodes.INVALID_URI_FORMAT),
            codes(validator.validate("add_movie", base.copy().put("poster_url", "not a uri"))));
        assertEquals(List.of(ValidationCodes.INVALID_URI_FORMAT),
            codes(validator.validate("add_movie", base.copy().put("poster_url", ""))));
    }

    @Test
    @DisplayName("Array length and element paths")
    void testArrays() {
        ValidationResult result = validator.validate("sampler", new JsonObject()
            .put("tags", new JsonArray().add("a").add(2).add("c")));

        assertEquals(List.of(ValidationCodes.ARRAY_TOO_LONG, ValidationCodes.TYPE_MISMATCH), codes(result));
        assertEquals("tags", result.getErrors().get(0).getField());
        assertEquals("array with 3 items", result.getErrors().get(0).getValue());
        assertEquals("tags[1]", result.getErrors().get(1).getField());

        ValidationResult empty = validator.validate("bulk_movie_import",
            new JsonObject().put("movies", new JsonArray()));
        assertEquals(List.of(ValidationCodes.ARRAY_TOO_SHORT), codes(empty));
    }

    @Test
    @DisplayName("Nested objects inside arrays report full paths")
    void testNestedPaths() {
        JsonArray movies = new JsonArray()
            .add(new JsonObject().put("title", "A").put("director", "B").put("year", 2001))
            .add(new JsonObject().put("title", "C").put("year", "1999").put("release_date", "1999-99-01"))
            .add(new JsonObject().put("title", "D").put("director", "E").put("year", 2003).put("rating", -1));

        ValidationResult result = validator.validate("bulk_movie_import", new JsonObject().put("movies", movies));

        assertFalse(result.isValid());
        assertEquals(List.of("movies[1].year", "movies[1].release_date", "movies[1].director", "movies[2].rating"),
            fields(result));
        assertEquals(List.of(ValidationCodes.TYPE_MISMATCH, ValidationCodes.INVALID_DATE_FORMAT,
            ValidationCodes.REQUIRED_PROPERTY_MISSING, ValidationCodes.VALUE_TOO_SMALL), codes(result));
    }

    @Test
    @DisplayName("Undeclared sub-properties of an object are allowed")
    void testObjectExtraPropertiesAllowed() {
        ValidationResult result = validator.validate("movie_recommendation_engine", new JsonObject()
            .put("user_preferences", new JsonObject()
                .put("genres", new JsonArray().add("Drama"))
                .put("favourite_snack", "popcorn")));

        assertTrue(result.isValid(), result.toString());
    }

    @Test
    @DisplayName("Unsupported or missing field types are reported")
    void testUnsupportedType() {
        ValidationResult result = validator.validate("sampler", new JsonObject()
            .put("blob", "x")
            .put("untyped", 1));

        assertEquals(List.of(ValidationCodes.UNSUPPORTED_TYPE, ValidationCodes.UNSUPPORTED_TYPE), codes(result));
        assertEquals("Unsupported field type: tuple", result.getErrors().get(0).getMessage());
        assertEquals("Field schema missing type", result.getErrors().get(1).getMessage());
    }

    @Test
    @DisplayName("Validation is deterministic")
    void testDeterministic() {
        JsonObject args = new JsonObject()
            .put("count", 99)
            .put("mode", "x")
            .put("tags", new JsonArray().add(1).add(2).add(3))
            .put("zzz", true);

        ValidationResult first = validator.validate("sampler", args);
        ValidationResult second = validator.validate("sampler", args.copy());

        assertEquals(first.getErrors(), second.getErrors());
        assertEquals(first.toJson(), second.toJson());
    }

    @Test
    @DisplayName("Known tools are exposed")
    void testSchemasExposed() {
        assertTrue(validator.hasTool("add_movie"));
        assertTrue(validator.hasTool("get_context_page"));
        assertFalse(validator.hasTool("frobnicate"));
        assertEquals(CatalogToolSchemas.allTools().size() + 1, validator.getSchemas().size());
    }

    @Test
    @DisplayName("Date helper edge cases")
    void testDateHelper() {
        assertTrue(ToolCallValidator.isValidDateFormat("1000-01-01"));
        assertTrue(ToolCallValidator.isValidDateFormat("9999-12-31"));
        assertFalse(ToolCallValidator.isValidDateFormat("2023-12-32"));
        assertFalse(ToolCallValidator.isValidDateFormat("+123-12-01"));
        assertFalse(ToolCallValidator.isValidDateFormat("2023--1-01"));
    }
}
