package io.openapivalidator.javalin.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.model.ParameterUpdates;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link JavalinRequestAdapter} against a mocked Javalin {@link Context}. */
class JavalinRequestAdapterTest {

    private final JavalinRequestAdapter adapter = new JavalinRequestAdapter();
    private Context ctx;

    @BeforeEach
    void setUp() {
        ctx = mock(Context.class);
        when(ctx.method()).thenReturn(HandlerType.POST);
        when(ctx.path()).thenReturn("/teams/7/members/9");
        Map<String, String> pathParams = new LinkedHashMap<>();
        pathParams.put("teamId", "7");
        pathParams.put("memberId", "9");
        when(ctx.pathParamMap()).thenReturn(pathParams);
        Map<String, List<String>> queryParams = new LinkedHashMap<>();
        queryParams.put("notify", List.of("true", "false"));
        queryParams.put("empty", List.of());
        when(ctx.queryParamMap()).thenReturn(queryParams);
        when(ctx.contentType()).thenReturn("Application/JSON; charset=UTF-8");
        when(ctx.bodyAsBytes()).thenReturn("{\"name\":\"Ada\"}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void wrapsMethodPathAndParameters() {
        IncomingRequest request = adapter.wrapRequest(ctx);

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/teams/7/members/9");
        assertThat(request.pathParameters().keySet()).containsExactly("teamId", "memberId");
        assertThat(request.queryParameters()).containsOnly(Map.entry("notify", "true"));
    }

    @Test
    void parameterStoreMergesQueryAndPath() {
        IncomingRequest request = adapter.wrapRequest(ctx);

        assertThat(request.parameters())
                .containsEntry("notify", "true")
                .containsEntry("teamId", "7")
                .containsEntry("memberId", "9");
        verify(ctx).attribute(eq(JavalinRequestAdapter.PARAMETERS_ATTRIBUTE), any());
    }

    @Test
    void contentTypeIsNormalised() {
        assertThat(adapter.wrapRequest(ctx).contentType()).isEqualTo("application/json");
        assertThat(JavalinRequestAdapter.mediaType(null)).isNull();
        assertThat(JavalinRequestAdapter.mediaType(" ; charset=UTF-8")).isNull();
    }

    @Test
    void bodyIsReadLazily() throws Exception {
        IncomingRequest request = adapter.wrapRequest(ctx);

        verify(ctx, never()).bodyAsBytes();
        try (InputStream in = request.body().open()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"Ada\"}");
        }
    }

    @Test
    void applyChangesWritesIntoExistingStore() {
        Map<String, Object> store = new LinkedHashMap<>();
        store.put("notify", "true");
        when(ctx.<Map<String, Object>>attribute(JavalinRequestAdapter.PARAMETERS_ATTRIBUTE)).thenReturn(store);

        adapter.applyChanges(ParameterUpdates.builder().put("notify", Boolean.TRUE).build(), ctx);

        assertThat(store).containsEntry("notify", Boolean.TRUE);
    }

    @Test
    void emptyUpdatesTouchNothing() {
        adapter.applyChanges(ParameterUpdates.none(), ctx);

        verify(ctx, never()).attribute(eq(JavalinRequestAdapter.PARAMETERS_ATTRIBUTE), any());
    }
}
