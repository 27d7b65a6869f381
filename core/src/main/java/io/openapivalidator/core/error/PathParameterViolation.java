package io.openapivalidator.core.error;

/**
 * Thrown when a path parameter fails its referenced schema. Raised immediately rather than
 * collected: a mismatching path means the route and the contract disagree. URN: {@code
 * urn:openapi-validator:error:path-parameter-invalid}
 */
public final class PathParameterViolation extends RequestValidationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:path-parameter-invalid";

    private final String parameter;

    public PathParameterViolation(String message, String parameter) {
        super(message);
        this.parameter = parameter;
    }

    /** Name of the offending path parameter. */
    public String parameter() {
        return parameter;
    }

    @Override
    public String urn() {
        return URN;
    }
}
