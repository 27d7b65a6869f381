package io.openapivalidator.core.engine;

import java.nio.file.Path;

final class Fixtures {

    static final Path OPENAPI = Path.of("src/test/resources/openapi.yml");

    private Fixtures() {
        // utility class
    }

    static Path fixture(String name) {
        return Path.of("src/test/resources/" + name);
    }
}
