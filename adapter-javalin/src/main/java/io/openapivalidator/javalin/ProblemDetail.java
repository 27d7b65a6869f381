package io.openapivalidator.javalin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.openapivalidator.core.error.BodyParseException;
import io.openapivalidator.core.error.RequestBodyViolation;
import io.openapivalidator.core.error.RequestValidationException;
import io.openapivalidator.core.error.SpecLoadException;
import io.openapivalidator.core.model.ValidationError;

/**
 * Builds RFC 9457 Problem Details responses for validation failures.
 *
 * <p>
 * Every method returns a {@link JsonNode} in RFC 9457 format:
 * <pre>{@code
 * {
 * "type": "urn:openapi-validator:error:body-invalid",
 * "title": "Invalid Request",
 * "status": 400,
 * "detail": "$: required property 'email' not found",
 * "instance": "/users"
 * }
 * }</pre>
 * Body violations additionally carry an {@code errors} array with one object per schema error.
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_SPEC_UNAVAILABLE = "urn:openapi-validator:error:spec-unavailable";

    private ProblemDetail() {
        // utility class
    }

    /**
     * A request that violates the OpenAPI document.
     *
     * @param status       the configured rejection status
     * @param instancePath the request path
     */
    public static JsonNode requestInvalid(RequestValidationException e, int status, String instancePath) {
        ObjectNode node = build(e.urn(), "Invalid Request", status, e.getMessage(), instancePath);
        if (e instanceof RequestBodyViolation) {
            ArrayNode errors = node.putArray("errors");
            for (ValidationError error : ((RequestBodyViolation) e).errors()) {
                errors.add(error.toJson());
            }
        }
        return node;
    }

    /** A body that could not be read or parsed. Always 400. */
    public static JsonNode bodyUnparseable(BodyParseException e, String instancePath) {
        return build(BodyParseException.URN, "Bad Request", 400, e.getMessage(), instancePath);
    }

    /** The OpenAPI document could not be loaded. Always 500. */
    public static JsonNode specUnavailable(SpecLoadException e, String instancePath) {
        return build(URN_SPEC_UNAVAILABLE, "Internal Server Error", 500, e.getMessage(), instancePath);
    }

    /**
     * Builds a standard RFC 9457 Problem Details JSON object.
     *
     * @param type         URN identifying the error category
     * @param title        short human-readable title
     * @param status       HTTP status code
     * @param detail       human-readable description
     * @param instancePath request path (may be null)
     */
    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
