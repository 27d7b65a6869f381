package io.openapivalidator.core.spi;

import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.ParameterUpdates;

/**
 * Framework adapter SPI. Bridges a web framework's native request type and the validator's
 * {@link IncomingRequest} snapshot.
 *
 * <h3>Copy-on-wrap semantics</h3>
 * <p>
 * {@link #wrapRequest} takes a snapshot: later changes to the native request are not visible to
 * the validator, and validation never changes the native request. When validation succeeds the
 * caller hands the resulting {@link ParameterUpdates} to {@link #applyChanges}, which is the only
 * place the native parameter store is written. On failure nothing is written back.
 *
 * <p>
 * Implementations MUST be thread-safe. A single adapter instance is typically shared across
 * request threads.
 *
 * @param <R> the framework-native request type (e.g. Javalin's {@code Context})
 */
public interface RequestAdapter<R> {

    /**
     * Snapshots a native request.
     *
     * <p>
     * Implementations MUST populate the method, the raw (still encoded) path, the routed path
     * parameters in router order, the first value of each query parameter, the general parameter
     * store, the content type without parameters, and a deferred body.
     */
    IncomingRequest wrapRequest(R nativeRequest);

    /** Writes parameter updates back into the native request's parameter store. */
    void applyChanges(ParameterUpdates updates, R nativeTarget);
}
