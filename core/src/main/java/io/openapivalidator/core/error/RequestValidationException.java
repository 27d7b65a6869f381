package io.openapivalidator.core.error;

/**
 * Thrown when a request violates the OpenAPI document. Callers translate it into a client-visible
 * response. URN: {@code urn:openapi-validator:error:request-invalid}
 */
public class RequestValidationException extends OpenApiValidatorException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:request-invalid";

    public RequestValidationException(String message) {
        super(message, Phase.REQUEST);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause, Phase.REQUEST);
    }

    /** URN identifying the error category in problem-detail responses. */
    public String urn() {
        return URN;
    }
}
