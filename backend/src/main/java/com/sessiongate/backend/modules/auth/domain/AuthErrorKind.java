package com.sessiongate.backend.modules.auth.domain;

import com.sessiongate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Every way an authentication step can fail. Each kind carries the HTTP status
 * and problem code used when it surfaces through the API.
 */
public enum AuthErrorKind {

    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED, "Invalid username or password"),
    TOKEN_MISSING(HttpStatus.UNAUTHORIZED, "Authentication token is missing"),
    EXPIRED_SIGNATURE(HttpStatus.UNAUTHORIZED, "Token has expired"),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, "Token signature is invalid"),
    MALFORMED_TOKEN(HttpStatus.UNAUTHORIZED, "Token could not be decoded"),
    INVALID_TOKEN_TYPE(HttpStatus.UNAUTHORIZED, "Token type is not accepted here"),
    SESSION_NOT_FOUND(HttpStatus.UNAUTHORIZED, "No active session for this token"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Administrator privileges required"),
    CONFLICT(HttpStatus.CONFLICT, "Username or email already registered"),
    STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String defaultDetail;

    AuthErrorKind(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultDetail() {
        return defaultDetail;
    }

    /**
     * Token decoding and session lookup failures the gate answers by sending the
     * client back to the login route.
     */
    public boolean requiresLogin() {
        return switch (this) {
            case TOKEN_MISSING, INVALID_SIGNATURE, MALFORMED_TOKEN, INVALID_TOKEN_TYPE,
                    SESSION_NOT_FOUND, USER_NOT_FOUND, NOT_AUTHENTICATED -> true;
            default -> false;
        };
    }

    public ProblemException toProblem() {
        return new ProblemException(status, name(), defaultDetail);
    }
}
