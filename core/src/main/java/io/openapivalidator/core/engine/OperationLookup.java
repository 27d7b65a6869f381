package io.openapivalidator.core.engine;

import io.openapivalidator.core.error.OperationNotFoundException;
import io.openapivalidator.core.error.ReferenceNotFoundException;
import io.openapivalidator.core.model.OperationLocator;
import io.openapivalidator.core.spec.OpenApiDocument;
import io.openapivalidator.core.spec.SchemaNode;
import io.openapivalidator.core.spec.SchemaResolver;
import java.util.Locale;

/** Finds the operation node for a locator, reporting a miss as a request error. */
final class OperationLookup {

    private OperationLookup() {
        // utility class
    }

    /**
     * @throws OperationNotFoundException if the document has no operation for the method and path
     */
    static SchemaNode find(SchemaResolver resolver, OpenApiDocument document, OperationLocator locator) {
        SchemaNode operation;
        try {
            operation = resolver.resolve(document, locator.pointer());
        } catch (ReferenceNotFoundException e) {
            throw notFound(locator, e);
        }
        if (!operation.node().isObject()) {
            throw notFound(locator, null);
        }
        return operation;
    }

    private static OperationNotFoundException notFound(OperationLocator locator, Throwable cause) {
        return new OperationNotFoundException(
                "No operation for " + locator.verb().toUpperCase(Locale.ROOT) + " " + locator.templatedPath(),
                locator.key(),
                cause);
    }
}
