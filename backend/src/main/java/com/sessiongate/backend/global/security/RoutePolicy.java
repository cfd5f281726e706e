package com.sessiongate.backend.global.security;

import java.util.List;
import java.util.Set;

import com.sessiongate.backend.global.config.AuthProperties;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.stereotype.Component;

/**
 * Classifies request paths from the configured public paths, public prefixes and
 * admin prefixes. Anything not listed is a protected user route.
 */
@Component
public class RoutePolicy {

    private final Set<String> publicPaths;
    private final List<String> publicPrefixes;
    private final List<String> adminPrefixes;

    public RoutePolicy(AuthProperties properties) {
        AuthProperties.Routes routes = properties.routes();
        this.publicPaths = Set.copyOf(routes.publicPaths());
        this.publicPrefixes = List.copyOf(routes.publicPrefixes());
        this.adminPrefixes = List.copyOf(routes.adminPrefixes());
    }

    public RouteClass classify(String path) {
        if (publicPaths.contains(path) || publicPrefixes.stream().anyMatch(path::startsWith)) {
            return RouteClass.PUBLIC;
        }
        boolean admin = adminPrefixes.stream()
                .anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
        return admin ? RouteClass.PROTECTED_ADMIN : RouteClass.PROTECTED_USER;
    }

    public RouteClass classify(HttpServletRequest request) {
        return classify(pathWithinApplication(request));
    }

    public static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
