package org.macrohooks.shape;

import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of matching or rewriting a shape: either a value or a {@link ShapeViolation}.
 * Shape checks report failures through this type instead of throwing, so the rewrite core stays
 * exception-free and only the host boundary decides how to surface a violation.
 *
 * @param <T> The type of the value on success.
 */
public final class ShapeResult<T> {

    private final T value;
    private final ShapeViolation violation;

    private ShapeResult(T value, ShapeViolation violation) {
        this.value = value;
        this.violation = violation;
    }

    /**
     * @param value The matched value.
     * @return A successful result holding {@code value}.
     */
    public static <T> ShapeResult<T> success(T value) {
        return new ShapeResult<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * @param violation The reason the shape did not match.
     * @return A failed result.
     */
    public static <T> ShapeResult<T> failure(ShapeViolation violation) {
        return new ShapeResult<>(null, Objects.requireNonNull(violation, "violation"));
    }

    /**
     * Shorthand for {@code failure(new ShapeViolation(expected, received))}.
     */
    public static <T> ShapeResult<T> failure(String expected, String received) {
        return failure(new ShapeViolation(expected, received));
    }

    public boolean isSuccess() {
        return violation == null;
    }

    /**
     * @return The matched value.
     * @throws IllegalStateException if this result is a failure.
     */
    public T value() {
        if (violation != null) {
            throw new IllegalStateException("No value present: " + violation);
        }
        return value;
    }

    /**
     * @return The violation.
     * @throws IllegalStateException if this result is a success.
     */
    public ShapeViolation violation() {
        if (violation == null) {
            throw new IllegalStateException("Result is a success");
        }
        return violation;
    }

    public <U> ShapeResult<U> map(Function<? super T, ? extends U> mapper) {
        if (violation != null) {
            return failure(violation);
        }
        return success(mapper.apply(value));
    }

    public <U> ShapeResult<U> flatMap(Function<? super T, ShapeResult<U>> mapper) {
        if (violation != null) {
            return failure(violation);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ShapeResult[success=" + value + "]" : "ShapeResult[violation=" + violation + "]";
    }
}
