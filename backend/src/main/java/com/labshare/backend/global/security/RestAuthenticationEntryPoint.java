package com.labshare.backend.global.security;

import java.io.IOException;

import com.labshare.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for protected routes. Also expires both auth cookies so the client stops resending them.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;
    private final AuthCookies authCookies;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper, AuthCookies authCookies) {
        this.objectMapper = objectMapper;
        this.authCookies = authCookies;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "unauthorized",
                "Authentication is required.", request.getRequestURI());

        authCookies.clear(request, response);
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
