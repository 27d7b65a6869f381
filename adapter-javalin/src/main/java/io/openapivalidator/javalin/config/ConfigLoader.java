package io.openapivalidator.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Loads {@link ValidatorConfig} from a YAML file with optional environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code openapi-validator.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Recognised keys, each with its overriding environment variable:
 *
 * <pre>
 * openapi.path           OPENAPI_SPEC_PATH
 * openapi.preload        OPENAPI_PRELOAD
 * openapi.routing-keys   OPENAPI_ROUTING_KEYS      (comma-separated)
 * validation.parameters  VALIDATE_PARAMETERS
 * validation.body        VALIDATE_BODY
 * errors.status          VALIDATION_ERROR_STATUS
 * </pre>
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is considered "set" if and only if it is
 * defined AND its trimmed value is non-empty; empty or whitespace-only values are treated as
 * "unset" and the YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "openapi-validator.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ValidatorConfig} from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or an invalid value
     */
    public static ValidatorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ValidatorConfig} from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from {@code envLookup}
     * means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or an invalid value
     */
    public static ValidatorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.missingNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ValidatorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ValidatorConfig.Builder builder = ValidatorConfig.builder();

        // --- YAML mapping ---

        JsonNode openapi = root.path("openapi");
        if (openapi.has("path")) builder.specPath(openapi.get("path").asText());
        if (openapi.has("preload")) builder.preload(openapi.get("preload").asBoolean());
        if (openapi.has("routing-keys")) builder.routingKeys(textList(openapi.get("routing-keys")));

        JsonNode validation = root.path("validation");
        if (validation.has("parameters"))
            builder.validateParameters(validation.get("parameters").asBoolean());
        if (validation.has("body")) builder.validateBody(validation.get("body").asBoolean());

        JsonNode errors = root.path("errors");
        if (errors.has("status")) builder.errorStatus(intValue(errors.get("status"), "errors.status"));

        // --- Environment variable overlay ---

        envString(envLookup, "OPENAPI_SPEC_PATH", builder::specPath);
        envBool(envLookup, "OPENAPI_PRELOAD", builder::preload);
        envString(envLookup, "OPENAPI_ROUTING_KEYS", value -> builder.routingKeys(splitList(value)));
        envBool(envLookup, "VALIDATE_PARAMETERS", builder::validateParameters);
        envBool(envLookup, "VALIDATE_BODY", builder::validateBody);
        envInt(envLookup, "VALIDATION_ERROR_STATUS", builder::errorStatus);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String key) {
        if (!node.canConvertToInt()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + node.asText() + "'");
        }
        return node.asInt();
    }

    private static List<String> textList(JsonNode node) {
        if (node.isTextual()) {
            return splitList(node.asText());
        }
        List<String> values = new ArrayList<>();
        node.forEach(value -> values.add(value.asText()));
        return values;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
