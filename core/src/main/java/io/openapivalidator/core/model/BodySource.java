package io.openapivalidator.core.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Deferred access to a request body. Adapters hand one of these to {@link IncomingRequest} so the
 * body is only read when a validator actually needs it.
 */
@FunctionalInterface
public interface BodySource {

    /** Opens a stream over the UTF-8 encoded body. The caller closes it. */
    InputStream open() throws IOException;

    /** A body backed by the given bytes. */
    static BodySource of(byte[] content) {
        byte[] bytes = content != null ? content : new byte[0];
        return () -> new ByteArrayInputStream(bytes);
    }

    /** A body backed by the UTF-8 encoding of the given string. */
    static BodySource of(String content) {
        return of(content != null ? content.getBytes(StandardCharsets.UTF_8) : null);
    }

    /** An empty body. */
    static BodySource empty() {
        return of(new byte[0]);
    }
}
