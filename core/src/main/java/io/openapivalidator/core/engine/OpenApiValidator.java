package io.openapivalidator.core.engine;

import io.openapivalidator.core.error.RequestBodyViolation;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.OperationLocator;
import io.openapivalidator.core.model.ParameterUpdates;
import io.openapivalidator.core.model.ValidationError;
import io.openapivalidator.core.model.ValidationErrors;
import io.openapivalidator.core.spec.OpenApiDocument;
import io.openapivalidator.core.spec.SchemaResolver;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates incoming requests against one OpenAPI 3.0 document.
 *
 * <p>
 * The document is loaded on first use and kept until {@link #invalidate()} or a
 * {@link #relocate(Path) relocation} drops it. Loaded documents are immutable, so one validator
 * can serve concurrent requests. Invalidation is not coordinated with loads already in flight;
 * such a request may finish against the previous document.
 *
 * <p>
 * Typical use from a framework hook:
 *
 * <pre>{@code
 * OpenApiValidator validator = new OpenApiValidator(ValidatorOptions.builder()
 *         .specPath(Path.of("openapi.yml"))
 *         .build());
 * ParameterUpdates updates = validator.validateRequest(request);
 * }</pre>
 */
public final class OpenApiValidator {

    private static final Logger LOG = LoggerFactory.getLogger(OpenApiValidator.class);

    private final SchemaResolver resolver;
    private final PathTemplater templater;
    private final BodyValidator bodyValidator;
    private final ParameterValidator parameterValidator;

    private volatile Path specPath;
    private volatile OpenApiDocument document;

    /** Validator for {@code openapi.yml} in the working directory. */
    public OpenApiValidator() {
        this(ValidatorOptions.defaults());
    }

    public OpenApiValidator(ValidatorOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.resolver = new SchemaResolver(options.referenceResolver());
        this.templater = new PathTemplater(options.routingKeys());
        this.bodyValidator = new BodyValidator(resolver);
        this.parameterValidator = new ParameterValidator(resolver);
        this.specPath = options.specPath();
    }

    /**
     * Returns the document, loading it first if needed.
     *
     * @throws io.openapivalidator.core.error.SpecLoadException if the document cannot be loaded
     */
    public OpenApiDocument document() {
        OpenApiDocument current = document;
        if (current == null) {
            current = resolver.load(specPath);
            document = current;
        }
        return current;
    }

    /** Loads the document now so the first request does not pay for it. */
    public OpenApiValidator preload() {
        document();
        return this;
    }

    /** Drops the loaded document; the next request reloads it. */
    public void invalidate() {
        document = null;
        LOG.debug("Invalidated OpenAPI document {}", specPath);
    }

    /** Points the validator at another document. Relocating to the current path keeps the cache. */
    public void relocate(Path newSpecPath) {
        Objects.requireNonNull(newSpecPath, "newSpecPath must not be null");
        if (newSpecPath.equals(specPath)) {
            return;
        }
        LOG.info("Relocating OpenAPI document from {} to {}", specPath, newSpecPath);
        specPath = newSpecPath;
        invalidate();
    }

    /** Current document location. */
    public Path specPath() {
        return specPath;
    }

    /**
     * Finds the operation the request is addressed to.
     *
     * <p>
     * The document is only consulted when two path parameters share a value. The request is then
     * templated against each path key with exactly those placeholders, substituting in the order
     * the operation declares its path parameters, and the first key it reproduces wins. Without
     * such a key the router's order applies.
     */
    public OperationLocator locate(IncomingRequest request) {
        OperationLocator routed = templater.locate(request);
        if (!templater.hasSharedValues(request)) {
            return routed;
        }
        OpenApiDocument current = document();
        Set<String> names = templater.substitutableNames(request);
        Iterator<String> pathKeys = current.root().path("paths").fieldNames();
        while (pathKeys.hasNext()) {
            String pathKey = pathKeys.next();
            List<String> placeholders = PathTemplater.placeholders(pathKey);
            if (placeholders.size() != names.size() || !names.containsAll(placeholders)) {
                continue;
            }
            OperationLocator candidate = new OperationLocator(pathKey, request.method());
            List<String> order = new ArrayList<>(parameterValidator.declaredPathParameters(current, candidate));
            order.addAll(placeholders);
            if (pathKey.equals(templater.template(request, order))) {
                LOG.debug("Shared path values in {} resolved to {} by declared order {}", request.path(), candidate, order);
                return candidate;
            }
        }
        return routed;
    }

    /**
     * Validates the request body. See {@link BodyValidator#validate}.
     *
     * @return {@code null} for GET and DELETE, otherwise the lazy error sequence
     */
    public ValidationErrors validateBody(IncomingRequest request) {
        if (!BodyValidator.expectsBody(request.method())) {
            return null;
        }
        return bodyValidator.validate(document(), locate(request), request);
    }

    /** Validates path parameters and casts query parameters. See {@link ParameterValidator#apply}. */
    public ParameterUpdates applyParameters(IncomingRequest request) {
        return parameterValidator.apply(document(), locate(request), request);
    }

    /**
     * Validates the request body and raises if it has any schema violation.
     *
     * @throws RequestBodyViolation carrying every error, its message joining the error texts with {@code "; "}
     */
    public void requireValidBody(IncomingRequest request) {
        ValidationErrors errors = validateBody(request);
        if (errors == null || errors.isEmpty()) {
            return;
        }
        List<ValidationError> collected = errors.toList();
        LOG.debug("{} {} failed body validation with {} error(s)", request.method(), request.path(), collected.size());
        throw new RequestBodyViolation(
                collected.stream().map(ValidationError::error).collect(Collectors.joining("; ")), collected);
    }

    /**
     * Runs the full check a request hook needs: parameters first, then the body.
     *
     * @return the parameter updates the caller should apply to its parameter store
     * @throws io.openapivalidator.core.error.RequestValidationException if the request is invalid;
     *         body schema violations arrive as a {@link RequestBodyViolation}
     */
    public ParameterUpdates validateRequest(IncomingRequest request) {
        ParameterUpdates updates = applyParameters(request);
        requireValidBody(request);
        LOG.debug("{} {} is valid; {} parameter update(s)", request.method(), request.path(), updates.asMap().size());
        return updates;
    }
}
