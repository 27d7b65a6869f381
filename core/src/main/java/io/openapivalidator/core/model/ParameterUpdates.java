package io.openapivalidator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parameter values produced by parameter validation: cast query values and validated path
 * values, keyed by parameter name.
 *
 * <p>
 * Validation never mutates the request. The caller owns the parameter store and applies these
 * updates explicitly via {@link #applyTo(Map)}, usually from
 * {@link io.openapivalidator.core.spi.RequestAdapter#applyChanges}. Values may be {@code null}
 * (an empty boolean query value casts to {@code null}).
 */
public final class ParameterUpdates {

    private static final ParameterUpdates NONE = new ParameterUpdates(Map.of());

    private final Map<String, Object> values;

    private ParameterUpdates(Map<String, Object> values) {
        this.values = values;
    }

    /** Returns an instance carrying no updates. */
    public static ParameterUpdates none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Writes every update into {@code target}, replacing existing values. */
    public void applyTo(Map<String, Object> target) {
        target.putAll(values);
    }

    /** True if an update exists for {@code name} (its value may still be {@code null}). */
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** The updated value for {@code name}, or {@code null} if absent or cast to {@code null}. */
    public Object get(String name) {
        return values.get(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Unmodifiable view in the order the parameters were declared. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ParameterUpdates" + values;
    }

    /** Accumulates updates in declaration order. */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        Builder() {}

        public Builder put(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public ParameterUpdates build() {
            return values.isEmpty()
                    ? NONE
                    : new ParameterUpdates(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
