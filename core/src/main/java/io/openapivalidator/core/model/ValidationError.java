package io.openapivalidator.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A single schema violation found while validating a request body or path parameter.
 *
 * <p>
 * The string form is the JSON object rendering of all fields, e.g.
 * <pre>{@code
 * {"type":"required","error":"$: required property 'email' not found","data_pointer":"$","schema_pointer":"#/required"}
 * }</pre>
 *
 * @param type          the JSON Schema keyword that failed (e.g. {@code required}, {@code pattern})
 * @param error         human-readable message
 * @param dataPointer   location of the offending value in the instance, nullable
 * @param schemaPointer location of the failing keyword in the schema, nullable
 */
public record ValidationError(String type, String error, String dataPointer, String schemaPointer) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ValidationError {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }

    /** Renders this error as a JSON object with {@code type}, {@code error} and the pointer fields. */
    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("error", error);
        node.put("data_pointer", dataPointer);
        node.put("schema_pointer", schemaPointer);
        return node;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
