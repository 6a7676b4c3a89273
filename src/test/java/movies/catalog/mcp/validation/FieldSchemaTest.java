package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldSchemaTest {

    @Test
    @DisplayName("String keywords")
    void testStringSchema() {
        FieldSchema schema = FieldSchema.fromJson(new JsonObject()
            .put("type", "string")
            .put("minLength", 1)
            .put("maxLength", 5)
            .put("enum", new JsonArray().add("a").add("b"))
            .put("minimum", 3));

        assertEquals(FieldKind.STRING, schema.getKind());
        assertEquals(1, schema.getMinLength());
        assertEquals(5, schema.getMaxLength());
        assertEquals(List.of("a", "b"), schema.getEnumValues());
        // keywords of other kinds are ignored
        assertNull(schema.getMinimum());
    }

    @Test
    @DisplayName("Date pattern is kept apart from format")
    void testDatePattern() {
        FieldSchema schema = FieldSchema.fromJson(new JsonObject()
            .put("type", "string")
            .put("pattern", FieldSchema.DATE_PATTERN));
        assertTrue(schema.hasDatePattern());
        assertNull(schema.getFormat());

        FieldSchema both = FieldSchema.fromJson(new JsonObject()
            .put("type", "string")
            .put("format", "uri")
            .put("pattern", FieldSchema.DATE_PATTERN));
        assertTrue(both.hasDatePattern());
        assertEquals("uri", both.getFormat());

        FieldSchema other = FieldSchema.fromJson(new JsonObject()
            .put("type", "string")
            .put("pattern", "^[a-z]+$"));
        assertFalse(other.hasDatePattern());
        assertNull(other.getFormat());
    }

    @Test
    @DisplayName("Nested array of objects")
    void testNestedSchema() {
        FieldSchema schema = FieldSchema.fromJson(new JsonObject()
            .put("type", "array")
            .put("minItems", 1)
            .put("items", new JsonObject()
                .put("type", "object")
                .put("properties", new JsonObject()
                    .put("year", new JsonObject().put("type", "integer").put("minimum", 1888)))
                .put("required", new JsonArray().add("year"))));

        assertEquals(FieldKind.ARRAY, schema.getKind());
        assertEquals(1, schema.getMinItems());
        FieldSchema item = schema.getItems();
        assertEquals(FieldKind.OBJECT, item.getKind());
        assertEquals(List.of("year"), item.getRequired());
        assertEquals(1888.0, item.getProperties().get("year").getMinimum());
    }

    @Test
    @DisplayName("Missing or unknown type is unsupported")
    void testUnsupported() {
        assertEquals(FieldKind.UNSUPPORTED, FieldSchema.fromJson(new JsonObject()).getKind());
        assertNull(FieldSchema.fromJson(new JsonObject()).getDeclaredType());
        FieldSchema unknown = FieldSchema.fromJson(new JsonObject().put("type", "tuple"));
        assertEquals(FieldKind.UNSUPPORTED, unknown.getKind());
        assertEquals("tuple", unknown.getDeclaredType());
        assertEquals(FieldKind.UNSUPPORTED, FieldSchema.fromJson(null).getKind());
    }
}
