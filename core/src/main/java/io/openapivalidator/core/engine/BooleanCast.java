package io.openapivalidator.core.engine;

import java.util.Set;

/**
 * Boolean interpretation of query-string values, matching the conventions of Rails' ActiveModel:
 * the empty string is no value, a small fixed set of spellings is {@code false}, and everything
 * else is {@code true}.
 */
final class BooleanCast {

    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "false", "FALSE", "off", "OFF");

    private BooleanCast() {
        // utility class
    }

    /**
     * Casts a query value.
     *
     * @return {@code null} for {@code ""}, {@code false} for {@code 0/f/F/false/FALSE/off/OFF},
     *         {@code true} otherwise
     */
    static Boolean cast(String value) {
        if (value.isEmpty()) {
            return null;
        }
        return !FALSE_VALUES.contains(value);
    }
}
