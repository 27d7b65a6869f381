package io.openapivalidator.core.model;

import com.fasterxml.jackson.core.JsonPointer;
import io.openapivalidator.core.spec.JsonPointers;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one operation in an OpenAPI document: a templated path plus a lowercase HTTP verb.
 * Computed per request and never persisted.
 *
 * @param templatedPath the OpenAPI path key, e.g. {@code /users/{id}}
 * @param verb          the lowercase HTTP method, e.g. {@code get}
 */
public record OperationLocator(String templatedPath, String verb) {

    public OperationLocator {
        Objects.requireNonNull(templatedPath, "templatedPath must not be null");
        Objects.requireNonNull(verb, "verb must not be null");
        verb = verb.toLowerCase(Locale.ROOT);
    }

    /** The escaped path segment, e.g. {@code ~1users~1{id}}. */
    public String pathSegment() {
        return JsonPointers.escape(templatedPath);
    }

    /** Document-relative key, e.g. {@code paths/~1users~1{id}/get}. */
    public String key() {
        return "paths/" + pathSegment() + "/" + verb;
    }

    /** JSON pointer to the operation node. */
    public JsonPointer pointer() {
        return JsonPointer.compile("/" + key());
    }

    /** JSON pointer to the enclosing path item. */
    public JsonPointer pathItemPointer() {
        return JsonPointer.compile("/paths/" + pathSegment());
    }

    /** JSON pointer to a node below the operation, e.g. {@code requestBody/content/application~1json/schema}. */
    public JsonPointer pointer(String relative) {
        return JsonPointer.compile("/" + key() + "/" + relative);
    }

    @Override
    public String toString() {
        return key();
    }
}
