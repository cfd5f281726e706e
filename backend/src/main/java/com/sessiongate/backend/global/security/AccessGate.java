package com.sessiongate.backend.global.security;

import com.sessiongate.backend.global.config.AuthProperties;
import com.sessiongate.backend.modules.auth.application.SessionManager;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;

import org.springframework.stereotype.Component;

/**
 * Decides, from the path and the presented access token alone, whether a request
 * may proceed. Rules apply in order:
 * <ol>
 *     <li>a live session on the login route is sent home</li>
 *     <li>public routes pass without a token</li>
 *     <li>every other route needs a token that resolves to an identity</li>
 *     <li>admin routes additionally need a superuser</li>
 * </ol>
 */
@Component
public class AccessGate {

    private final RoutePolicy routePolicy;
    private final SessionManager sessionManager;
    private final String loginRoute;

    public AccessGate(RoutePolicy routePolicy, SessionManager sessionManager, AuthProperties properties) {
        this.routePolicy = routePolicy;
        this.sessionManager = sessionManager;
        this.loginRoute = properties.routes().login();
    }

    public GateDecision evaluate(String path, String accessToken) {
        boolean hasToken = accessToken != null && !accessToken.isBlank();

        if (hasToken && loginRoute.equals(path)) {
            AuthResult<UserIdentity> current = sessionManager.resolveIdentity(accessToken);
            if (current.isSuccess()) {
                return GateDecision.alreadyAuthenticated(current.value());
            }
        }

        RouteClass routeClass = routePolicy.classify(path);
        if (routeClass == RouteClass.PUBLIC) {
            return GateDecision.allowed(routeClass, null);
        }
        if (!hasToken) {
            return GateDecision.denied(routeClass, AuthErrorKind.TOKEN_MISSING);
        }

        AuthResult<UserIdentity> resolved = sessionManager.resolveIdentity(accessToken);
        if (resolved.isFailure()) {
            return GateDecision.denied(routeClass, resolved.error());
        }
        UserIdentity identity = resolved.value();
        if (routeClass == RouteClass.PROTECTED_ADMIN && !identity.superuser()) {
            return GateDecision.denied(routeClass, AuthErrorKind.FORBIDDEN);
        }
        return GateDecision.allowed(routeClass, identity);
    }
}
