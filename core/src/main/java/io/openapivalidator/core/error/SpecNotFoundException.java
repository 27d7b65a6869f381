package io.openapivalidator.core.error;

/** Thrown when the configured OpenAPI document does not exist. */
public final class SpecNotFoundException extends SpecLoadException {

    private static final long serialVersionUID = 1L;

    public SpecNotFoundException(String message, String source) {
        super(message, source);
    }

    public SpecNotFoundException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
