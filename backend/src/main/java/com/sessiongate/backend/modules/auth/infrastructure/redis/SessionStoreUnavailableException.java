package com.sessiongate.backend.modules.auth.infrastructure.redis;

public class SessionStoreUnavailableException extends RuntimeException {

    public SessionStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
