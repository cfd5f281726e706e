package com.sessiongate.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.sessiongate.backend.global.error.ProblemResponse;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AccessGate} for every request. Allowed requests continue with the
 * resolved identity in the security context and in the {@link #IDENTITY_ATTRIBUTE}
 * request attribute; denied requests are answered here and never reach a controller.
 */
@Component
public class AccessGateFilter extends OncePerRequestFilter {

    public static final String IDENTITY_ATTRIBUTE = "sessiongate.identity";

    private static final Logger log = LoggerFactory.getLogger(AccessGateFilter.class);

    private final AccessGate accessGate;
    private final GateResponses gateResponses;
    private final AuthCookies authCookies;
    private final ObjectMapper objectMapper;

    public AccessGateFilter(AccessGate accessGate, GateResponses gateResponses, AuthCookies authCookies,
                            ObjectMapper objectMapper) {
        this.accessGate = accessGate;
        this.gateResponses = gateResponses;
        this.authCookies = authCookies;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String path = RoutePolicy.pathWithinApplication(request);
        String token = AccessTokenExtractor.extract(request).orElse(null);
        GateDecision decision = accessGate.evaluate(path, token);

        switch (decision.outcome()) {
            case ALREADY_AUTHENTICATED -> write(request, response, gateResponses.forAlreadyAuthenticated());
            case DENIED -> {
                log.debug("Access to {} denied: {}", path, decision.denial());
                SecurityContextHolder.clearContext();
                write(request, response, gateResponses.forDenial(decision.denial(), originalUrl(request)));
            }
            case ALLOWED -> {
                if (decision.identity() != null) {
                    authenticate(request, decision.identity());
                }
                filterChain.doFilter(request, response);
            }
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    private void authenticate(HttpServletRequest request, UserIdentity identity) {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (identity.superuser()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        AuthenticatedUser principal = new AuthenticatedUser(identity.id(), identity.username(), identity.superuser());
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        request.setAttribute(IDENTITY_ATTRIBUTE, identity);
    }

    private void write(HttpServletRequest request, HttpServletResponse response, GateResponse gateResponse)
            throws IOException {
        if (gateResponse.clearCookies()) {
            authCookies.clear(response);
        }
        response.setStatus(gateResponse.status().value());
        if (gateResponse.isRedirect()) {
            response.setHeader(HttpHeaders.LOCATION, gateResponse.location());
            return;
        }
        ProblemResponse body = ProblemResponse.of(gateResponse.status(), gateResponse.code(), gateResponse.detail(),
                request.getRequestURI());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private static String originalUrl(HttpServletRequest request) {
        StringBuilder url = new StringBuilder(request.getRequestURL());
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }
}
