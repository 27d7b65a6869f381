package io.openapivalidator.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.openapivalidator.core.model.ValidationError;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the three-branch structure, the common fields and
 * every concrete exception type.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void rootIsAbstractRuntimeException() {
        assertThat(OpenApiValidatorException.class).isAbstract();
        assertThat(OpenApiValidatorException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void specLoadExceptionIsAbstract() {
        assertThat(SpecLoadException.class).isAbstract();
        assertThat(SpecLoadException.class.getSuperclass()).isEqualTo(OpenApiValidatorException.class);
    }

    @Test
    void bodyParseExceptionIsNotARequestValidationException() {
        assertThat(BodyParseException.class.getSuperclass()).isEqualTo(OpenApiValidatorException.class);
        assertThat(RequestValidationException.class.isAssignableFrom(BodyParseException.class)).isFalse();
    }

    // --- Load-time exceptions ---

    @Test
    void specNotFoundCarriesSource() {
        var ex = new SpecNotFoundException("missing", "/srv/openapi.yml");

        assertThat(ex).isInstanceOf(SpecLoadException.class);
        assertThat(ex.phase()).isEqualTo(OpenApiValidatorException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/srv/openapi.yml");
        assertThat(ex.detail()).isEqualTo("missing");
    }

    @Test
    void specParseExceptionKeepsCause() {
        var cause = new IllegalStateException("bad yaml");
        var ex = new SpecParseException("unparseable", cause, "/srv/openapi.yml");

        assertThat(ex).isInstanceOf(SpecLoadException.class);
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void referenceNotFoundCarriesReference() {
        var ex = new ReferenceNotFoundException("dangling", "#/components/schemas/Gone", "file:/srv/openapi.yml");

        assertThat(ex).isInstanceOf(SpecLoadException.class);
        assertThat(ex.reference()).isEqualTo("#/components/schemas/Gone");
        assertThat(ex.source()).isEqualTo("file:/srv/openapi.yml");
    }

    // --- Request-time exceptions ---

    @Test
    void requestValidationExceptionIsConcrete() {
        var ex = new RequestValidationException("bad request");

        assertThat(ex.phase()).isEqualTo(OpenApiValidatorException.Phase.REQUEST);
        assertThat(ex.urn()).isEqualTo(RequestValidationException.URN);
    }

    @Test
    void contentTypeExceptionHasFixedMessage() {
        var ex = new ContentTypeException();

        assertThat(ex).isInstanceOf(RequestValidationException.class);
        assertThat(ex.getMessage()).isEqualTo("\"Content-Type\" request header must be set to \"application/json\".");
        assertThat(ex.urn()).isEqualTo("urn:openapi-validator:error:unsupported-content-type");
    }

    @Test
    void operationNotFoundCarriesOperationKey() {
        var ex = new OperationNotFoundException("No operation for HEAD /users", "paths/~1users/head", null);

        assertThat(ex).isInstanceOf(RequestValidationException.class);
        assertThat(ex.operation()).isEqualTo("paths/~1users/head");
        assertThat(ex.urn()).isEqualTo(OperationNotFoundException.URN);
    }

    @Test
    void pathParameterViolationCarriesParameterName() {
        var ex = new PathParameterViolation("pattern mismatch", "id");

        assertThat(ex).isInstanceOf(RequestValidationException.class);
        assertThat(ex.parameter()).isEqualTo("id");
        assertThat(ex.urn()).isEqualTo(PathParameterViolation.URN);
    }

    @Test
    void requestBodyViolationCopiesErrors() {
        var error = new ValidationError("required", "$: required property 'email' not found", "$", "#/required");
        var ex = new RequestBodyViolation("$: required property 'email' not found", List.of(error));

        assertThat(ex).isInstanceOf(RequestValidationException.class);
        assertThat(ex.errors()).containsExactly(error);
        assertThat(ex.urn()).isEqualTo(RequestBodyViolation.URN);
    }

    @Test
    void bodyParseExceptionIsRequestPhase() {
        var ex = new BodyParseException("not json");

        assertThat(ex.phase()).isEqualTo(OpenApiValidatorException.Phase.REQUEST);
        assertThat(ex.urn()).isEqualTo(BodyParseException.URN);
    }
}
