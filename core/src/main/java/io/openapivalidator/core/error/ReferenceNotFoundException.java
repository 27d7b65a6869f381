package io.openapivalidator.core.error;

/** Thrown when a JSON pointer or {@code $ref} does not resolve to a node. */
public final class ReferenceNotFoundException extends SpecLoadException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public ReferenceNotFoundException(String message, String reference, String source) {
        super(message, source);
        this.reference = reference;
    }

    public ReferenceNotFoundException(String message, Throwable cause, String reference, String source) {
        super(message, cause, source);
        this.reference = reference;
    }

    /** The pointer or {@code $ref} value that could not be resolved. */
    public String reference() {
        return reference;
    }
}
