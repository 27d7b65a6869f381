package io.openapivalidator.core.error;

/**
 * Thrown when an OpenAPI document (or a document it references) is not valid YAML/JSON, or its
 * structure cannot be used: a non-object root, a parameter without a name, a cyclic reference chain.
 */
public final class SpecParseException extends SpecLoadException {

    private static final long serialVersionUID = 1L;

    public SpecParseException(String message, String source) {
        super(message, source);
    }

    public SpecParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
