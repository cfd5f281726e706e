package com.sessiongate.backend.modules.auth.domain;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an authentication step: either a value or exactly one {@link AuthErrorKind}.
 * A successful result may carry a {@code null} value.
 */
public record AuthResult<T>(T value, AuthErrorKind error) {

    public static <T> AuthResult<T> success(T value) {
        return new AuthResult<>(value, null);
    }

    public static <T> AuthResult<T> failure(AuthErrorKind error) {
        return new AuthResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <U> AuthResult<U> map(Function<? super T, ? extends U> mapper) {
        if (isFailure()) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <U> AuthResult<U> flatMap(Function<? super T, AuthResult<U>> mapper) {
        if (isFailure()) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    /**
     * Returns the value or throws the error as a problem response.
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw error.toProblem();
        }
        return value;
    }
}
