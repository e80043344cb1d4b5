package com.advisorplatform.common.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Explicit success-or-failure value returned across component boundaries
 * (model gateway, specialist invocation) instead of a raw reactive error signal.
 *
 * @param <T> success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorKind kind, String message) {
        return new Err<>(kind, message);
    }

    static <T> Result<T> err(Throwable error) {
        return new Err<>(ErrorKind.classify(error),
            error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    boolean isOk();

    /** @throws IllegalStateException on an {@link Err} */
    T value();

    /** @throws IllegalStateException on an {@link Ok} */
    ErrorKind kind();

    String message();

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        Err<T> err = (Err<T>) this;
        return new Err<>(err.kind(), err.message());
    }

    default T orElse(T fallback) {
        return isOk() ? value() : fallback;
    }

    record Ok<T>(T value) implements Result<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override public boolean isOk() { return true; }

        @Override public ErrorKind kind() {
            throw new IllegalStateException("Ok has no error kind");
        }

        @Override public String message() { return null; }
    }

    record Err<T>(ErrorKind kind, String message) implements Result<T> {
        public Err {
            Objects.requireNonNull(kind, "kind");
        }

        @Override public boolean isOk() { return false; }

        @Override public T value() {
            throw new IllegalStateException("Err has no value: " + kind + " " + message);
        }
    }
}
