package io.openapivalidator.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.openapivalidator.core.error.OperationNotFoundException;
import io.openapivalidator.core.error.SpecParseException;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.OperationLocator;
import io.openapivalidator.core.model.ParameterUpdates;
import io.openapivalidator.core.spec.OpenApiDocument;
import io.openapivalidator.core.spec.SchemaNode;
import io.openapivalidator.core.spec.SchemaResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a request's parameters against the operation's declared parameters and produces the
 * resulting {@link ParameterUpdates}: query values cast to their declared type and path values
 * that passed their referenced schema.
 *
 * <p>
 * Parameters declared on the path item apply to every operation below it; an operation-level
 * parameter with the same {@code name} and {@code in} replaces the path-level one. A missing
 * {@code parameters} array is the same as an empty one.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ParameterValidator {

    private final SchemaResolver resolver;

    public ParameterValidator(SchemaResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Validates and casts the request's parameters.
     *
     * @return the updates to apply to the request's parameter store
     * @throws io.openapivalidator.core.error.OperationNotFoundException if the operation does not exist
     * @throws io.openapivalidator.core.error.PathParameterViolation     if a path value fails its schema
     */
    public ParameterUpdates apply(OpenApiDocument document, OperationLocator locator, IncomingRequest request) {
        SchemaNode operation = OperationLookup.find(resolver, document, locator);
        ParameterContext context = new ParameterContext(document, resolver, request);
        ParameterUpdates.Builder updates = ParameterUpdates.builder();
        for (ParameterSpec spec : declaredParameters(document, locator, operation)) {
            spec.apply(context, updates);
        }
        return updates.build();
    }

    /**
     * Names of the {@code in: path} parameters in effect for {@code locator}, in declaration order,
     * or an empty list when the document has no such operation.
     */
    List<String> declaredPathParameters(OpenApiDocument document, OperationLocator locator) {
        SchemaNode operation;
        try {
            operation = OperationLookup.find(resolver, document, locator);
        } catch (OperationNotFoundException e) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (ParameterSpec spec : declaredParameters(document, locator, operation)) {
            if (spec instanceof ParameterSpec.Path) {
                names.add(spec.name());
            }
        }
        return names;
    }

    /** The parameters in effect for an operation, path-level first. */
    List<ParameterSpec> declaredParameters(OpenApiDocument document, OperationLocator locator, SchemaNode operation) {
        Map<String, ParameterSpec> merged = new LinkedHashMap<>();
        collect(document, resolver.resolve(document, locator.pathItemPointer()), merged);
        collect(document, operation, merged);
        return new ArrayList<>(merged.values());
    }

    private void collect(OpenApiDocument document, SchemaNode owner, Map<String, ParameterSpec> into) {
        JsonNode parameters = owner.node().get("parameters");
        if (parameters == null || parameters.isNull()) {
            return;
        }
        if (!parameters.isArray()) {
            throw new SpecParseException(
                    "'parameters' at " + owner.location() + " must be an array", String.valueOf(owner.base()));
        }
        SchemaNode list = owner.child("parameters", parameters);
        for (int i = 0; i < parameters.size(); i++) {
            SchemaNode entry = resolver.dereference(document, list.child(String.valueOf(i), parameters.get(i)));
            ParameterSpec spec = ParameterSpec.from(entry);
            if (spec != null) {
                into.put(spec.in() + ":" + spec.name(), spec);
            }
        }
    }
}
