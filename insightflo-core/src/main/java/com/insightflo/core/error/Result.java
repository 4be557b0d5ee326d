package com.insightflo.core.error;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that degrades instead of throwing.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    record Ok<T>(T result) implements Result<T> {
    }

    record Err<T>(ErrorKind kind, String message, Throwable cause) implements Result<T> {
        public Err(ErrorKind kind, String message) {
            this(kind, message, null);
        }
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorKind kind, String message) {
        return new Err<>(kind, message);
    }

    static <T> Result<T> err(ErrorKind kind, String message, Throwable cause) {
        return new Err<>(kind, message, cause);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default Optional<T> value() {
        if (this instanceof Ok<T> ok) {
            return Optional.ofNullable(ok.result());
        }
        return Optional.empty();
    }

    default Optional<ErrorKind> errorKind() {
        if (this instanceof Err<T> err) {
            return Optional.of(err.kind());
        }
        return Optional.empty();
    }

    default T orElse(T fallback) {
        return value().orElse(fallback);
    }

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.result()));
        }
        Err<T> err = (Err<T>) this;
        return new Err<>(err.kind(), err.message(), err.cause());
    }
}
