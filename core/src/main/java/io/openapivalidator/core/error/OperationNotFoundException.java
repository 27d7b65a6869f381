package io.openapivalidator.core.error;

/**
 * Thrown when no operation exists for the request's method and templated path. URN: {@code
 * urn:openapi-validator:error:operation-not-found}
 */
public final class OperationNotFoundException extends RequestValidationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:operation-not-found";

    private final String operation;

    public OperationNotFoundException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** The operation key that failed to resolve, e.g. {@code paths/~1users/head}. */
    public String operation() {
        return operation;
    }

    @Override
    public String urn() {
        return URN;
    }
}
