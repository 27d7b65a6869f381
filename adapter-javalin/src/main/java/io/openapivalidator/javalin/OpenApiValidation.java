package io.openapivalidator.javalin;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.openapivalidator.core.engine.OpenApiValidator;
import io.openapivalidator.core.error.BodyParseException;
import io.openapivalidator.core.error.RequestValidationException;
import io.openapivalidator.core.error.SpecLoadException;
import io.openapivalidator.javalin.adapter.JavalinRequestAdapter;
import io.openapivalidator.javalin.config.ConfigLoader;
import io.openapivalidator.javalin.config.ValidatorConfig;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAPI request validation for Javalin applications.
 *
 * <pre>{@code
 * OpenApiValidation validation = OpenApiValidation.load(ConfigLoader.resolveConfigPath(args));
 * Javalin app = Javalin.create();
 * validation.install(app);
 * app.post("/users", validation.validating(ctx -> {
 *     Map<String, Object> params = JavalinRequestAdapter.parameters(ctx);
 *     ...
 * }));
 * }</pre>
 *
 * <p>
 * Error mapping, rendered as {@code application/problem+json}:
 * <ul>
 * <li>{@link RequestValidationException}: the configured status (400 by default)</li>
 * <li>{@link BodyParseException}: 400</li>
 * <li>{@link SpecLoadException}: 500</li>
 * </ul>
 */
public final class OpenApiValidation {

    private static final Logger LOG = LoggerFactory.getLogger(OpenApiValidation.class);

    private final OpenApiValidator validator;
    private final ValidatorConfig config;
    private final JavalinRequestAdapter adapter = new JavalinRequestAdapter();

    OpenApiValidation(OpenApiValidator validator, ValidatorConfig config) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates validation from a configuration, loading the document now if {@code preload} is set.
     *
     * @throws SpecLoadException if preloading fails
     */
    public static OpenApiValidation fromConfig(ValidatorConfig config) {
        OpenApiValidator validator = new OpenApiValidator(config.toOptions());
        if (config.preload()) {
            validator.preload();
        }
        LOG.info(
                "OpenAPI validation configured: spec={}, preload={}, parameters={}, body={}, errorStatus={}",
                config.specPath(),
                config.preload(),
                config.validateParameters(),
                config.validateBody(),
                config.errorStatus());
        return new OpenApiValidation(validator, config);
    }

    /**
     * Loads the configuration file and creates validation from it.
     *
     * @throws io.openapivalidator.javalin.config.ConfigLoadException if the configuration is invalid
     */
    public static OpenApiValidation load(Path configPath) {
        return fromConfig(ConfigLoader.load(configPath));
    }

    /** Registers the exception handlers that turn validation failures into problem responses. */
    public OpenApiValidation install(Javalin app) {
        app.exception(RequestValidationException.class, (e, ctx) -> {
            LOG.info("Rejected {} {}: {}", ctx.method().name(), ctx.path(), e.getMessage());
            respond(ctx, config.errorStatus(), ProblemDetail.requestInvalid(e, config.errorStatus(), ctx.path())
                    .toString());
        });
        app.exception(BodyParseException.class, (e, ctx) -> {
            LOG.info("Unreadable body on {} {}: {}", ctx.method().name(), ctx.path(), e.getMessage());
            respond(ctx, 400, ProblemDetail.bodyUnparseable(e, ctx.path()).toString());
        });
        app.exception(SpecLoadException.class, (e, ctx) -> {
            LOG.error("OpenAPI document unavailable: {}", e.getMessage(), e);
            respond(ctx, 500, ProblemDetail.specUnavailable(e, ctx.path()).toString());
        });
        return this;
    }

    /** Wraps {@code handler} so it only runs for requests that pass validation. */
    public Handler validating(Handler handler) {
        return new ValidatingHandler(validator, adapter, config, handler);
    }

    /** The underlying validator, e.g. to {@link OpenApiValidator#invalidate() invalidate} it. */
    public OpenApiValidator validator() {
        return validator;
    }

    public ValidatorConfig config() {
        return config;
    }

    private static void respond(Context ctx, int status, String problem) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(problem);
    }
}
