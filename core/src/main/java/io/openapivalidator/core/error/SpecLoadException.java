package io.openapivalidator.core.error;

/**
 * Abstract parent for errors caused by the OpenAPI document itself: a missing file, unparseable
 * content or a reference that leads nowhere. These indicate misconfiguration, not a bad request.
 * Carries a {@code source} field identifying the file or reference that caused the error.
 */
public abstract class SpecLoadException extends OpenApiValidatorException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SpecLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected SpecLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or document URI that caused the error. */
    public String source() {
        return source;
    }
}
