package io.openapivalidator.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openapivalidator.core.error.BodyParseException;
import io.openapivalidator.core.error.ContentTypeException;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.OperationLocator;
import io.openapivalidator.core.model.ValidationErrors;
import io.openapivalidator.core.spec.OpenApiDocument;
import io.openapivalidator.core.spec.SchemaNode;
import io.openapivalidator.core.spec.SchemaResolver;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a request body against the operation's {@code application/json} request-body schema.
 *
 * <p>
 * GET and DELETE requests are never inspected. Every other request must be sent as exactly
 * {@code application/json}, whether or not its operation exists or declares a body. Operations that
 * declare no {@code requestBody} then yield an empty sequence without touching the body. Otherwise
 * the body must parse as JSON and the resulting errors are returned lazily. Only transport, parse and lookup failures raise; schema violations
 * are data.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class BodyValidator {

    private static final Logger LOG = LoggerFactory.getLogger(BodyValidator.class);
    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    static final String JSON_MEDIA_TYPE = "application/json";
    static final String BODY_SCHEMA = "requestBody/content/application~1json/schema";

    private static final Set<String> BODYLESS_METHODS = Set.of("get", "delete");

    private final SchemaResolver resolver;

    public BodyValidator(SchemaResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /** False for GET and DELETE, whose bodies are never validated. */
    public static boolean expectsBody(String method) {
        return !BODYLESS_METHODS.contains(method.toLowerCase(Locale.ROOT));
    }

    /**
     * Validates the body of {@code request}.
     *
     * @return {@code null} for GET/DELETE, otherwise the (possibly empty) lazy error sequence
     * @throws ContentTypeException                                      if the body is not sent as JSON
     * @throws io.openapivalidator.core.error.OperationNotFoundException if the operation does not exist
     * @throws BodyParseException                                        if the body is empty or malformed
     * @throws io.openapivalidator.core.error.ReferenceNotFoundException if the request body has no JSON schema
     */
    public ValidationErrors validate(OpenApiDocument document, OperationLocator locator, IncomingRequest request) {
        if (!expectsBody(request.method())) {
            return null;
        }
        if (!JSON_MEDIA_TYPE.equals(request.contentType())) {
            throw new ContentTypeException();
        }
        SchemaNode operation = OperationLookup.find(resolver, document, locator);
        if (!operation.node().has("requestBody")) {
            LOG.debug("{} declares no requestBody; body not validated", locator);
            return ValidationErrors.empty();
        }
        JsonNode instance = parse(request);
        SchemaNode schema = resolver.resolve(document, locator.pointer(BODY_SCHEMA));
        return resolver.validate(document, schema, instance);
    }

    private static JsonNode parse(IncomingRequest request) {
        try (InputStream in = request.body().open()) {
            JsonNode instance = JSON_MAPPER.readTree(in);
            if (instance == null || instance.isMissingNode()) {
                throw new BodyParseException("Request body is empty");
            }
            return instance;
        } catch (JsonProcessingException e) {
            throw new BodyParseException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BodyParseException("Failed to read request body", e);
        }
    }
}
