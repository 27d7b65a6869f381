package io.openapivalidator.javalin.config;

import io.openapivalidator.core.engine.PathTemplater;
import io.openapivalidator.core.engine.ValidatorOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for request validation in a Javalin application. Loaded by {@link ConfigLoader} or built
 * directly.
 *
 * @param specPath           location of the OpenAPI document
 * @param preload            load the document at startup instead of on the first request
 * @param routingKeys        path-parameter names excluded from path templating
 * @param validateParameters check path parameters and cast query parameters
 * @param validateBody       validate JSON request bodies
 * @param errorStatus        HTTP status for rejected requests
 */
public record ValidatorConfig(
        String specPath,
        boolean preload,
        List<String> routingKeys,
        boolean validateParameters,
        boolean validateBody,
        int errorStatus) {

    public static final String DEFAULT_SPEC_PATH = "openapi.yml";
    public static final int DEFAULT_ERROR_STATUS = 400;

    public ValidatorConfig {
        Objects.requireNonNull(specPath, "specPath must not be null");
        routingKeys = List.copyOf(routingKeys);
        if (errorStatus < 400 || errorStatus > 599) {
            throw new IllegalArgumentException("errorStatus must be a 4xx or 5xx status, got " + errorStatus);
        }
    }

    /** Core validator options equivalent to this configuration. */
    public ValidatorOptions toOptions() {
        return ValidatorOptions.builder()
                .specPath(Path.of(specPath))
                .routingKeys(Set.copyOf(routingKeys))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ValidatorConfig}; unset fields keep their defaults. */
    public static final class Builder {

        private String specPath = DEFAULT_SPEC_PATH;
        private boolean preload;
        private List<String> routingKeys = List.copyOf(PathTemplater.DEFAULT_ROUTING_KEYS);
        private boolean validateParameters = true;
        private boolean validateBody = true;
        private int errorStatus = DEFAULT_ERROR_STATUS;

        private Builder() {}

        public Builder specPath(String specPath) {
            this.specPath = specPath;
            return this;
        }

        public Builder preload(boolean preload) {
            this.preload = preload;
            return this;
        }

        public Builder routingKeys(List<String> routingKeys) {
            this.routingKeys = routingKeys;
            return this;
        }

        public Builder validateParameters(boolean validateParameters) {
            this.validateParameters = validateParameters;
            return this;
        }

        public Builder validateBody(boolean validateBody) {
            this.validateBody = validateBody;
            return this;
        }

        public Builder errorStatus(int errorStatus) {
            this.errorStatus = errorStatus;
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(specPath, preload, routingKeys, validateParameters, validateBody, errorStatus);
        }
    }
}
