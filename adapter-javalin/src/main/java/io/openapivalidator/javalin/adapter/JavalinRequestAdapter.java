package io.openapivalidator.javalin.adapter;

import io.javalin.http.Context;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.ParameterUpdates;
import io.openapivalidator.core.spi.RequestAdapter;
import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RequestAdapter} for Javalin's {@link Context}.
 *
 * <p>
 * Javalin has no merged parameter store of its own, so this adapter keeps one in a request
 * attribute ({@link #PARAMETERS_ATTRIBUTE}). It is seeded on first access with the first value of
 * every query parameter, overlaid by the path parameters. Validation writes cast and checked values
 * back into it via {@link #applyChanges}; handlers read it with {@link #parameters(Context)}.
 *
 * <p>
 * The body is read lazily, so GET and DELETE requests never touch it.
 *
 * <p>
 * This class is thread-safe: all state lives in the request context.
 */
public final class JavalinRequestAdapter implements RequestAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinRequestAdapter.class);

    /** Request attribute holding the general parameter store. */
    public static final String PARAMETERS_ATTRIBUTE = "openapi-validator.parameters";

    @Override
    public IncomingRequest wrapRequest(Context ctx) {
        String method = ctx.method().name();
        String path = ctx.path();
        LOG.debug("wrapRequest: {} {}", method, path);
        return IncomingRequest.builder()
                .method(method)
                .path(path)
                .pathParameters(ctx.pathParamMap())
                .queryParameters(extractQueryParams(ctx))
                .parameters(parameters(ctx))
                .contentType(mediaType(ctx.contentType()))
                .body(() -> new ByteArrayInputStream(ctx.bodyAsBytes()))
                .build();
    }

    @Override
    public void applyChanges(ParameterUpdates updates, Context ctx) {
        if (updates.isEmpty()) {
            return;
        }
        updates.applyTo(parameters(ctx));
        LOG.debug("applyChanges: {} parameter(s) updated", updates.asMap().size());
    }

    /**
     * Returns the request's general parameter store, creating it on first access. The map is
     * mutable and belongs to the request.
     */
    public static Map<String, Object> parameters(Context ctx) {
        Map<String, Object> store = ctx.attribute(PARAMETERS_ATTRIBUTE);
        if (store == null) {
            store = new LinkedHashMap<>(extractQueryParams(ctx));
            store.putAll(ctx.pathParamMap());
            ctx.attribute(PARAMETERS_ATTRIBUTE, store);
        }
        return store;
    }

    /**
     * Strips parameters such as {@code charset} from a Content-Type header and lowercases the
     * rest. Returns {@code null} for a missing or blank header.
     */
    static String mediaType(String contentType) {
        if (contentType == null) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        String type = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
        return type.isEmpty() ? null : type.toLowerCase(Locale.ROOT);
    }

    /** First value per query parameter; values are already URL-decoded by Javalin. */
    private static Map<String, String> extractQueryParams(Context ctx) {
        Map<String, String> queryParams = new LinkedHashMap<>();
        ctx.queryParamMap().forEach((key, values) -> {
            if (values != null && !values.isEmpty()) {
                queryParams.put(key, firstOf(values));
            }
        });
        return queryParams;
    }

    private static String firstOf(List<String> values) {
        return values.get(0);
    }
}
