package io.openapivalidator.javalin.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConfigLoader}: YAML mapping, defaults and failure reporting. */
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @Test
    void fullConfigMapsEveryKey() throws Exception {
        ValidatorConfig config = ConfigLoader.load(resource("config/full-config.yaml"), NO_ENV::get);

        assertThat(config.specPath()).isEqualTo("specs/api.yml");
        assertThat(config.preload()).isTrue();
        assertThat(config.routingKeys()).containsExactly("format", "locale");
        assertThat(config.validateParameters()).isFalse();
        assertThat(config.validateBody()).isTrue();
        assertThat(config.errorStatus()).isEqualTo(422);
    }

    @Test
    void minimalConfigUsesDefaults() throws Exception {
        ValidatorConfig config = ConfigLoader.load(resource("config/minimal-config.yaml"), NO_ENV::get);

        assertThat(config.specPath()).isEqualTo("api/openapi.yml");
        assertThat(config.preload()).isFalse();
        assertThat(config.routingKeys()).containsExactlyInAnyOrder("controller", "action");
        assertThat(config.validateParameters()).isTrue();
        assertThat(config.validateBody()).isTrue();
        assertThat(config.errorStatus()).isEqualTo(400);
    }

    @Test
    void routingKeysAcceptCommaSeparatedString() throws Exception {
        ValidatorConfig config = ConfigLoader.load(resource("config/routing-keys-string.yaml"), NO_ENV::get);

        assertThat(config.routingKeys()).containsExactly("controller", "action", "format");
    }

    @Test
    void toOptionsCarriesPathAndRoutingKeys() throws Exception {
        ValidatorConfig config = ConfigLoader.load(resource("config/full-config.yaml"), NO_ENV::get);

        assertThat(config.toOptions().specPath()).isEqualTo(Path.of("specs/api.yml"));
        assertThat(config.toOptions().routingKeys()).containsExactlyInAnyOrder("format", "locale");
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("does-not-exist.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("--config");
        }

        @Test
        void invalidYaml() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(resource("config/invalid-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void statusOutsideErrorRange() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(resource("config/bad-status.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("errorStatus");
        }

        @Test
        void nonNumericStatus() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(resource("config/non-numeric-status.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("errors.status");
        }
    }

    @Nested
    @DisplayName("Command line")
    class CommandLine {

        @Test
        void defaultConfigFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("openapi-validator.yaml"));
        }

        @Test
        void explicitConfigFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--verbose", "--config", "/etc/validator.yaml"}))
                    .isEqualTo(Path.of("/etc/validator.yaml"));
        }

        @Test
        void configFlagWithoutValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    static Path resource(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
