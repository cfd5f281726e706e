package com.sessiongate.backend.global.security;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.sessiongate.backend.global.config.AuthProperties;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Maps gate outcomes to responses:
 * <ul>
 *     <li>expired token: redirect to the refresh route, carrying the original URL</li>
 *     <li>missing or unusable token, unknown session or user: redirect to login and clear the cookies</li>
 *     <li>non-superuser on an admin route: 403</li>
 *     <li>anything else: 500 without detail</li>
 * </ul>
 */
@Component
public class GateResponses {

    static final String REDIRECT_URL_PARAM = "redirect_url";

    private final AuthProperties.Routes routes;

    public GateResponses(AuthProperties properties) {
        this.routes = properties.routes();
    }

    public GateResponse forDenial(AuthErrorKind denial, String originalUrl) {
        if (denial == AuthErrorKind.EXPIRED_SIGNATURE) {
            String target = routes.refresh() + "?" + REDIRECT_URL_PARAM + "="
                    + URLEncoder.encode(originalUrl, StandardCharsets.UTF_8);
            return GateResponse.redirect(target, false);
        }
        if (denial.requiresLogin()) {
            return GateResponse.redirect(routes.login(), true);
        }
        if (denial == AuthErrorKind.FORBIDDEN) {
            return GateResponse.problem(HttpStatus.FORBIDDEN, denial.name(), denial.defaultDetail());
        }
        return GateResponse.problem(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    public GateResponse forAlreadyAuthenticated() {
        return GateResponse.redirect(routes.home(), false);
    }
}
