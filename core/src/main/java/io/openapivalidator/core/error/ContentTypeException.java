package io.openapivalidator.core.error;

/**
 * Thrown when a body-carrying request is not sent as {@code application/json}. URN: {@code
 * urn:openapi-validator:error:unsupported-content-type}
 */
public final class ContentTypeException extends RequestValidationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:openapi-validator:error:unsupported-content-type";

    public static final String MESSAGE = "\"Content-Type\" request header must be set to \"application/json\".";

    public ContentTypeException() {
        super(MESSAGE);
    }

    @Override
    public String urn() {
        return URN;
    }
}
