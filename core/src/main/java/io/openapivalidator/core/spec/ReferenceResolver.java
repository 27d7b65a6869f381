package io.openapivalidator.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;

/**
 * Supplies the documents that external {@code $ref}s point into, e.g. the {@code common.yml} in
 * {@code common.yml#/components/schemas/Id}. Lets applications serve shared schema components
 * from somewhere other than the file system.
 *
 * <p>
 * Each document calls this at most once per URI it needs and keeps the result until it is
 * discarded. Implementations must be thread-safe if the owning validator is shared.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * Returns the root of the document at {@code uri}, or {@code null} if it is unknown.
     *
     * @param uri absolute document URI, without fragment
     */
    JsonNode resolve(URI uri);
}
