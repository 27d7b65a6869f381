package io.openapivalidator.javalin;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.openapivalidator.core.engine.OpenApiValidator;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.ParameterUpdates;
import io.openapivalidator.javalin.adapter.JavalinRequestAdapter;
import io.openapivalidator.javalin.config.ValidatorConfig;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Handler decorator that validates the request before the wrapped handler runs.
 *
 * <p>
 * Parameters are checked first, then the body, each only if enabled in {@link ValidatorConfig}. On
 * success the parameter updates are written to the request's parameter store and the delegate is
 * invoked. Failures propagate as exceptions; {@link OpenApiValidation#install} maps them to
 * problem-detail responses.
 *
 * <p>
 * The {@code X-Request-ID} header, when present, is put in the MDC under {@code requestId} for the
 * duration of the request.
 */
final class ValidatingHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatingHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    private final OpenApiValidator validator;
    private final JavalinRequestAdapter adapter;
    private final ValidatorConfig config;
    private final Handler delegate;

    ValidatingHandler(OpenApiValidator validator, JavalinRequestAdapter adapter, ValidatorConfig config, Handler delegate) {
        this.validator = validator;
        this.adapter = adapter;
        this.config = config;
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void handle(Context ctx) throws Exception {
        String requestId = ctx.header(REQUEST_ID_HEADER);
        boolean tagged = requestId != null && !requestId.isBlank();
        if (tagged) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
        try {
            IncomingRequest request = adapter.wrapRequest(ctx);
            ParameterUpdates updates =
                    config.validateParameters() ? validator.applyParameters(request) : ParameterUpdates.none();
            if (config.validateBody()) {
                validator.requireValidBody(request);
            }
            adapter.applyChanges(updates, ctx);
            LOG.debug("{} {} passed validation", request.method(), request.path());
            delegate.handle(ctx);
        } finally {
            if (tagged) {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }
}
