package com.di.loannova.common;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail in a reportable, recoverable way.
 *
 * <p>Used where a failure is data rather than an emergency: a row that breaks the
 * loan-tape contract, a KPI that cannot be computed. Unrecoverable conditions are
 * still thrown.
 *
 * @param <T> success value type
 * @param <E> failure payload type
 */
public final class Result<T, E> {

    private final T       value;
    private final E       error;
    private final boolean ok;

    private Result(T value, E error, boolean ok) {
        this.value = value;
        this.error = error;
        this.ok    = ok;
    }

    public static <T, E> Result<T, E> success(T value) {
        return new Result<>(value, null, true);
    }

    public static <T, E> Result<T, E> failure(E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), false);
    }

    public boolean isSuccess() {
        return ok;
    }

    public boolean isFailure() {
        return !ok;
    }

    public T getValue() {
        if (!ok) throw new NoSuchElementException("Result is a failure: " + error);
        return value;
    }

    public E getError() {
        if (ok) throw new NoSuchElementException("Result is a success");
        return error;
    }

    public <U> Result<U, E> map(Function<? super T, ? extends U> fn) {
        return ok ? success(fn.apply(value)) : failure(error);
    }

    public T orElse(T fallback) {
        return ok ? value : fallback;
    }

    @Override
    public String toString() {
        return ok ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
