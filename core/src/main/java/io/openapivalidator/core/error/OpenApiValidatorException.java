package io.openapivalidator.core.error;

/**
 * Abstract base for all openapi-validator exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SpecLoadException}, {@link RequestValidationException} or
 * {@link BodyParseException}.
 */
public abstract class OpenApiValidatorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        REQUEST
    }

    private final Phase phase;

    protected OpenApiValidatorException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected OpenApiValidatorException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
