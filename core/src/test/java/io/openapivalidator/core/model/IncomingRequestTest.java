package io.openapivalidator.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IncomingRequestTest {

    @Test
    void builderDefaults() {
        IncomingRequest request = IncomingRequest.builder().build();

        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/");
        assertThat(request.pathParameters()).isEmpty();
        assertThat(request.contentType()).isNull();
    }

    @Test
    void mapsAreSnapshots() {
        Map<String, String> query = new HashMap<>();
        query.put("limit", "10");
        IncomingRequest request = IncomingRequest.builder().queryParameters(query).build();

        query.put("limit", "20");

        assertThat(request.queryParameters()).containsEntry("limit", "10");
        assertThatThrownBy(() -> request.queryParameters().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void pathParameterOrderIsPreserved() {
        IncomingRequest request = IncomingRequest.builder()
                .pathParameter("teamId", "7")
                .pathParameter("memberId", "7")
                .pathParameter("controller", "members")
                .build();

        assertThat(request.pathParameters().keySet()).containsExactly("teamId", "memberId", "controller");
    }

    @Test
    void parameterStoreAllowsNullValues() {
        IncomingRequest request = IncomingRequest.builder().parameter("notify", null).build();

        assertThat(request.parameters()).containsEntry("notify", null);
    }

    @Test
    void bodyCanBeReopened() throws Exception {
        IncomingRequest request = IncomingRequest.builder().body("{\"a\":1}").build();

        for (int i = 0; i < 2; i++) {
            try (InputStream in = request.body().open()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
            }
        }
    }

    @Test
    void missingBodyIsEmpty() throws Exception {
        IncomingRequest request = IncomingRequest.builder().body((BodySource) null).build();

        try (InputStream in = request.body().open()) {
            assertThat(in.read()).isEqualTo(-1);
        }
    }
}
