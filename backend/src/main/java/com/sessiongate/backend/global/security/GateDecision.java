package com.sessiongate.backend.global.security;

import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;

/**
 * What the access gate decided for one request. {@code identity} is set whenever
 * the token resolved, {@code denial} only when the outcome is {@link Outcome#DENIED}.
 */
public record GateDecision(RouteClass routeClass, Outcome outcome, UserIdentity identity, AuthErrorKind denial) {

    public enum Outcome {
        ALLOWED,
        DENIED,
        ALREADY_AUTHENTICATED
    }

    public static GateDecision allowed(RouteClass routeClass, UserIdentity identity) {
        return new GateDecision(routeClass, Outcome.ALLOWED, identity, null);
    }

    public static GateDecision denied(RouteClass routeClass, AuthErrorKind denial) {
        return new GateDecision(routeClass, Outcome.DENIED, null, denial);
    }

    public static GateDecision alreadyAuthenticated(UserIdentity identity) {
        return new GateDecision(RouteClass.PUBLIC, Outcome.ALREADY_AUTHENTICATED, identity, null);
    }
}
