package io.openapivalidator.core.error;

import io.openapivalidator.core.model.ValidationError;
import java.util.List;

/**
 * Thrown by the request hook when the body does not satisfy the declared schema. Carries every
 * collected error. URN: {@code urn:openapi-validator:error:body-invalid}
 */
public final class RequestBodyViolation extends RequestValidationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:body-invalid";

    private final transient List<ValidationError> errors;

    public RequestBodyViolation(String message, List<ValidationError> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /** The schema violations, in the order the validator reported them. */
    public List<ValidationError> errors() {
        return errors;
    }

    @Override
    public String urn() {
        return URN;
    }
}
