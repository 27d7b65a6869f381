package io.openapivalidator.core.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Lazy, finite sequence of {@link ValidationError}s.
 *
 * <p>
 * The underlying validation runs the first time the sequence is consumed and the result is
 * memoized, so iterating twice does not validate twice. Not thread-safe; a sequence belongs to the
 * request that produced it.
 */
public final class ValidationErrors implements Iterable<ValidationError> {

    private static final ValidationErrors EMPTY = new ValidationErrors(List::of);

    private final Supplier<List<ValidationError>> source;
    private List<ValidationError> materialized;

    private ValidationErrors(Supplier<List<ValidationError>> source) {
        this.source = source;
    }

    /** Wraps a deferred validation run. The supplier is invoked at most once. */
    public static ValidationErrors lazy(Supplier<List<ValidationError>> source) {
        return new ValidationErrors(Objects.requireNonNull(source, "source must not be null"));
    }

    /** Returns an empty sequence. */
    public static ValidationErrors empty() {
        return EMPTY;
    }

    /** Runs the validation if needed and returns the errors as an unmodifiable list. */
    public List<ValidationError> toList() {
        if (materialized == null) {
            materialized = List.copyOf(source.get());
        }
        return materialized;
    }

    public boolean isEmpty() {
        return toList().isEmpty();
    }

    public Stream<ValidationError> stream() {
        return toList().stream();
    }

    @Override
    public Iterator<ValidationError> iterator() {
        return toList().iterator();
    }

    @Override
    public String toString() {
        return materialized != null ? "ValidationErrors" + materialized : "ValidationErrors[pending]";
    }
}
