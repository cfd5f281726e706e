package com.sessiongate.backend.global.security;

public enum RouteClass {
    PUBLIC,
    PROTECTED_USER,
    PROTECTED_ADMIN
}
