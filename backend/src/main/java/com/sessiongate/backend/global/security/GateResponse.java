package com.sessiongate.backend.global.security;

import org.springframework.http.HttpStatus;

/**
 * HTTP response for a request the gate stopped. Either a redirect ({@code location}
 * set) or a problem body ({@code code} set).
 */
public record GateResponse(HttpStatus status, String location, String code, String detail, boolean clearCookies) {

    public static GateResponse redirect(String location, boolean clearCookies) {
        return new GateResponse(HttpStatus.TEMPORARY_REDIRECT, location, null, null, clearCookies);
    }

    public static GateResponse problem(HttpStatus status, String code, String detail) {
        return new GateResponse(status, null, code, detail, false);
    }

    public boolean isRedirect() {
        return location != null;
    }
}
