package io.openapivalidator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral snapshot of an HTTP request. Adapters produce instances by wrapping their
 * native request objects (see {@link io.openapivalidator.core.spi.RequestAdapter}); the validators
 * never touch framework types.
 *
 * <p>
 * All maps are unmodifiable copies that preserve the adapter's iteration order and permit
 * {@code null} values. Path-parameter order matters: it is the order in which values are
 * substituted when templating the request path.
 *
 * @param method          HTTP method, any case
 * @param path            the request path as received, still percent-encoded
 * @param pathParameters  routed path parameters, possibly including routing-internal keys such as
 *                        {@code controller} and {@code action}
 * @param queryParameters query parameters, first value per name
 * @param parameters      the general parameter store the handler reads from
 * @param contentType     MIME type of the body without parameters, nullable
 * @param body            deferred body access
 */
public record IncomingRequest(
        String method,
        String path,
        Map<String, String> pathParameters,
        Map<String, String> queryParameters,
        Map<String, Object> parameters,
        String contentType,
        BodySource body) {

    public IncomingRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        pathParameters = copyOf(pathParameters);
        queryParameters = copyOf(queryParameters);
        parameters = copyOf(parameters);
        body = body != null ? body : BodySource.empty();
    }

    private static <V> Map<String, V> copyOf(Map<String, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    /** Creates a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link IncomingRequest}; mostly useful in adapters and tests. */
    public static final class Builder {
        private String method = "GET";
        private String path = "/";
        private final Map<String, String> pathParameters = new LinkedHashMap<>();
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private String contentType;
        private BodySource body;

        Builder() {}

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder pathParameter(String name, String value) {
            this.pathParameters.put(name, value);
            return this;
        }

        public Builder pathParameters(Map<String, String> pathParameters) {
            this.pathParameters.putAll(pathParameters);
            return this;
        }

        public Builder queryParameter(String name, String value) {
            this.queryParameters.put(name, value);
            return this;
        }

        public Builder queryParameters(Map<String, String> queryParameters) {
            this.queryParameters.putAll(queryParameters);
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder body(BodySource body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = BodySource.of(body);
            return this;
        }

        public IncomingRequest build() {
            return new IncomingRequest(
                    method, path, pathParameters, queryParameters, parameters, contentType, body);
        }
    }
}
