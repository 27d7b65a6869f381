package io.openapivalidator.core.engine;

import io.openapivalidator.core.model.IncomingRequest;
import io.openapivalidator.core.spec.OpenApiDocument;
import io.openapivalidator.core.spec.SchemaResolver;

/** Everything a {@link ParameterSpec} needs to check and cast one request value. */
record ParameterContext(OpenApiDocument document, SchemaResolver resolver, IncomingRequest request) {}
