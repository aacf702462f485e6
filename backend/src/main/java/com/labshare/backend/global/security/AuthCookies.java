package com.labshare.backend.global.security;

import java.time.Duration;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * 인증 쿠키 두 개(access_token, fingerprint)를 함께 쓰고 지운다.
 */
@Component
public class AuthCookies {

    public static final String ACCESS_TOKEN = "access_token";
    public static final String FINGERPRINT = "fingerprint";

    private static final String CLEARED_ATTRIBUTE = AuthCookies.class.getName() + ".CLEARED";
    private static final String SAME_SITE = "Lax";
    private static final String PATH = "/";

    private final boolean secure;
    private final Duration maxAge;

    public AuthCookies(
            @Value("${labshare.auth.cookies.secure:true}") boolean secure,
            @Value("${jwt.expiration:604800000}") long tokenTtlMillis
    ) {
        this.secure = secure;
        this.maxAge = Duration.ofMillis(tokenTtlMillis);
    }

    public static Optional<String> read(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public void write(HttpServletResponse response, String token, String fingerprint) {
        response.addHeader(HttpHeaders.SET_COOKIE, build(ACCESS_TOKEN, token, maxAge).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, build(FINGERPRINT, fingerprint, maxAge).toString());
    }

    /**
     * Expires both cookies. Repeated calls within one request add no further headers.
     */
    public void clear(HttpServletRequest request, HttpServletResponse response) {
        if (request.getAttribute(CLEARED_ATTRIBUTE) != null) {
            return;
        }
        request.setAttribute(CLEARED_ATTRIBUTE, Boolean.TRUE);
        response.addHeader(HttpHeaders.SET_COOKIE, build(ACCESS_TOKEN, "", Duration.ZERO).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, build(FINGERPRINT, "", Duration.ZERO).toString());
    }

    private ResponseCookie build(String name, String value, Duration cookieMaxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path(PATH)
                .maxAge(cookieMaxAge)
                .build();
    }
}
