package movies.catalog.mcp.validation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating one tool call. Valid exactly when there are no errors.
 */
public class ValidationResult {

    private final List<ValidationError> errors;

    public ValidationResult(List<ValidationError> errors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Convert to the wire shape {@code {valid, errors:[{field,value,message,code}]}}.
     */
    public JsonObject toJson() {
        JsonArray errorArray = new JsonArray();
        for (ValidationError error : errors) {
            errorArray.add(error.toJson());
        }
        return new JsonObject()
            .put("valid", isValid())
            .put("errors", errorArray);
    }

    public static ValidationResult fromJson(JsonObject json) {
        List<ValidationError> parsed = new ArrayList<>();
        JsonArray errorArray = json.getJsonArray("errors", new JsonArray());
        for (int i = 0; i < errorArray.size(); i++) {
            parsed.add(ValidationError.fromJson(errorArray.getJsonObject(i)));
        }
        return new ValidationResult(parsed);
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", errors=" + errors + "}";
    }
}
