package io.openapivalidator.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ValidationErrorsTest {

    private static final ValidationError MISSING_EMAIL =
            new ValidationError("required", "$: required property 'email' not found", "$", "#/required");

    @Test
    void lazySequenceRunsOnFirstConsumptionOnly() {
        AtomicInteger runs = new AtomicInteger();
        ValidationErrors errors = ValidationErrors.lazy(() -> {
            runs.incrementAndGet();
            return List.of(MISSING_EMAIL);
        });

        assertThat(runs).hasValue(0);
        assertThat(errors.toString()).isEqualTo("ValidationErrors[pending]");

        assertThat(errors).containsExactly(MISSING_EMAIL);
        assertThat(errors.isEmpty()).isFalse();
        assertThat(errors.stream().count()).isEqualTo(1);
        assertThat(runs).hasValue(1);
    }

    @Test
    void emptySequenceHasNoErrors() {
        assertThat(ValidationErrors.empty().isEmpty()).isTrue();
        assertThat(ValidationErrors.empty()).isEmpty();
    }

    @Test
    void errorStringFormIsJsonWithAllFields() throws Exception {
        JsonNode json = new ObjectMapper().readTree(MISSING_EMAIL.toString());

        assertThat(json.get("type").asText()).isEqualTo("required");
        assertThat(json.get("error").asText()).isEqualTo("$: required property 'email' not found");
        assertThat(json.get("data_pointer").asText()).isEqualTo("$");
        assertThat(json.get("schema_pointer").asText()).isEqualTo("#/required");
    }

    @Test
    void missingPointersRenderAsNull() {
        ValidationError error = new ValidationError("schema", "broken", null, null);

        assertThat(error.toJson().get("data_pointer").isNull()).isTrue();
    }
}
