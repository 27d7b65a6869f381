package io.openapivalidator.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.openapivalidator.core.error.PathParameterViolation;
import io.openapivalidator.core.error.SpecParseException;
import io.openapivalidator.core.model.ParameterUpdates;
import io.openapivalidator.core.model.ValidationError;
import io.openapivalidator.core.spec.SchemaNode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A declared OpenAPI parameter, one variant per supported location. Each variant knows how to
 * check and convert its own request value.
 *
 * <p>
 * Implementations are a sealed hierarchy. Header and cookie parameters have no variant and are
 * skipped by {@link #from(SchemaNode)}.
 */
public sealed interface ParameterSpec {

    /** The declared parameter name. */
    String name();

    /** The parameter's {@code schema} member as declared (possibly a {@code $ref}), or {@code null}. */
    SchemaNode schema();

    /** The OpenAPI {@code in} value of this variant. */
    String in();

    /** Checks the request's value for this parameter and records any update. */
    void apply(ParameterContext context, ParameterUpdates.Builder updates);

    /**
     * Builds the variant for a dereferenced parameter object.
     *
     * @return the parameter, or {@code null} for locations other than {@code query} and {@code path}
     * @throws SpecParseException if the parameter has no {@code name}
     */
    static ParameterSpec from(SchemaNode parameter) {
        JsonNode node = parameter.node();
        String in = node.path("in").asText("");
        String name = node.path("name").textValue();
        if (name == null) {
            throw new SpecParseException(
                    "Parameter at " + parameter.location() + " has no 'name'", String.valueOf(parameter.base()));
        }
        JsonNode schemaNode = node.get("schema");
        SchemaNode schema = schemaNode != null ? parameter.child("schema", schemaNode) : null;
        switch (in) {
            case "query":
                return new Query(name, schema);
            case "path":
                return new Path(name, schema);
            default:
                return null;
        }
    }

    // ── Implementations ──

    /**
     * A query parameter. Declared booleans are cast from their string form; every other type keeps
     * the original string. An update is produced only when the query carries the parameter and the
     * general parameter store already holds a value for it, so casting never introduces a key.
     */
    record Query(String name, SchemaNode schema) implements ParameterSpec {

        private static final Logger LOG = LoggerFactory.getLogger(Query.class);

        public Query {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String in() {
            return "query";
        }

        @Override
        public void apply(ParameterContext context, ParameterUpdates.Builder updates) {
            String raw = context.request().queryParameters().get(name);
            if (raw == null) {
                return;
            }
            Object current = context.request().parameters().get(name);
            if (current == null || Boolean.FALSE.equals(current)) {
                LOG.debug("Query parameter '{}' has no value in the parameter store; not cast", name);
                return;
            }
            if ("boolean".equals(declaredType(context))) {
                Boolean cast = BooleanCast.cast(raw);
                LOG.debug("Cast query parameter '{}' from '{}' to {}", name, raw, cast);
                updates.put(name, cast);
            } else {
                updates.put(name, raw);
            }
        }

        private String declaredType(ParameterContext context) {
            if (schema == null) {
                return null;
            }
            SchemaNode resolved = context.resolver().dereference(context.document(), schema);
            return resolved.node().path("type").asText(null);
        }
    }

    /**
     * A path parameter. Only schemas declared through {@code $ref} are validated; inline schemas
     * (a bare {@code type} or {@code pattern}) pass through unchecked. The value is copied into the
     * parameter store when present.
     */
    record Path(String name, SchemaNode schema) implements ParameterSpec {

        public Path {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String in() {
            return "path";
        }

        @Override
        public void apply(ParameterContext context, ParameterUpdates.Builder updates) {
            String value = context.request().pathParameters().get(name);
            String ref = schema != null ? schema.node().path("$ref").textValue() : null;
            if (ref != null) {
                SchemaNode target = context.resolver().resolveReference(context.document(), schema, ref);
                JsonNode instance = value != null ? TextNode.valueOf(value) : NullNode.getInstance();
                List<ValidationError> errors = context.resolver()
                        .validate(context.document(), target, instance)
                        .toList();
                if (!errors.isEmpty()) {
                    throw new PathParameterViolation(
                            errors.stream().map(ValidationError::toString).collect(Collectors.joining(", ")),
                            name);
                }
            }
            if (value != null) {
                updates.put(name, value);
            }
        }
    }
}
