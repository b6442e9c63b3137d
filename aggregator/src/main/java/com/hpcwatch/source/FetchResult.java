package com.hpcwatch.source;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one source query: either a value or a {@link FetchError}, never both.
 * Adapters return this instead of throwing so every caller decides explicitly whether a
 * failure aborts its pipeline or falls back to a default.
 */
public final class FetchResult<T> {

    private final T value;
    private final FetchError error;

    private FetchResult(T value, FetchError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FetchResult<T> failure(FetchError error) {
        return new FetchResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error);
        }
        return value;
    }

    public FetchError getError() {
        if (error == null) {
            throw new NoSuchElementException("No error present");
        }
        return error;
    }

    public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> FetchResult<R> flatMap(Function<? super T, FetchResult<R>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new FetchFailedException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "FetchResult[success]" : "FetchResult[" + error + "]";
    }
}
