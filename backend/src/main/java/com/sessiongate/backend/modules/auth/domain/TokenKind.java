package com.sessiongate.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.claimValue.equals(value))
                .findFirst();
    }
}
