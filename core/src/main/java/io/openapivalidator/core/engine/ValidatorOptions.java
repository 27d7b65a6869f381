package io.openapivalidator.core.engine;

import io.openapivalidator.core.spec.FileReferenceResolver;
import io.openapivalidator.core.spec.ReferenceResolver;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for an {@link OpenApiValidator}.
 *
 * @param specPath          location of the OpenAPI document
 * @param routingKeys       path-parameter names that are router bookkeeping, not URL segments
 * @param referenceResolver fetches documents named by external {@code $ref}s
 */
public record ValidatorOptions(Path specPath, Set<String> routingKeys, ReferenceResolver referenceResolver) {

    /** Default document location, relative to the working directory. */
    public static final Path DEFAULT_SPEC_PATH = Path.of("openapi.yml");

    public ValidatorOptions {
        Objects.requireNonNull(specPath, "specPath must not be null");
        routingKeys = routingKeys != null ? Set.copyOf(routingKeys) : PathTemplater.DEFAULT_ROUTING_KEYS;
        referenceResolver = referenceResolver != null ? referenceResolver : new FileReferenceResolver();
    }

    /** {@code openapi.yml}, the default routing keys and file-based reference resolution. */
    public static ValidatorOptions defaults() {
        return builder().build();
    }

    /** Creates a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ValidatorOptions}. */
    public static final class Builder {

        private Path specPath = DEFAULT_SPEC_PATH;
        private Set<String> routingKeys = PathTemplater.DEFAULT_ROUTING_KEYS;
        private ReferenceResolver referenceResolver;

        private Builder() {}

        public Builder specPath(Path specPath) {
            this.specPath = specPath;
            return this;
        }

        public Builder routingKeys(Set<String> routingKeys) {
            this.routingKeys = routingKeys;
            return this;
        }

        public Builder referenceResolver(ReferenceResolver referenceResolver) {
            this.referenceResolver = referenceResolver;
            return this;
        }

        public ValidatorOptions build() {
            return new ValidatorOptions(specPath, routingKeys, referenceResolver);
        }
    }
}
