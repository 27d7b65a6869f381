package io.openapivalidator.core.error;

/**
 * Thrown when the request body is empty, unreadable or not valid JSON. Kept apart from {@link
 * RequestValidationException} so callers can tell a transport problem from a contract violation.
 * URN: {@code urn:openapi-validator:error:body-unparseable}
 */
public final class BodyParseException extends OpenApiValidatorException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:body-unparseable";

    public BodyParseException(String message) {
        super(message, Phase.REQUEST);
    }

    public BodyParseException(String message, Throwable cause) {
        super(message, cause, Phase.REQUEST);
    }

    /** URN identifying the error category in problem-detail responses. */
    public String urn() {
        return URN;
    }
}
