package com.labshare.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.labshare.backend.global.error.ProblemResponse;
import com.labshare.backend.modules.auth.application.AuthGuard;
import com.labshare.backend.modules.auth.application.GuardDecision;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates a request from the access_token and fingerprint cookies.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    static final String ROLE_STUDENT = "ROLE_STUDENT";
    static final String BACKEND_UNAVAILABLE = "AUTH_BACKEND_UNAVAILABLE";

    private final AuthGuard authGuard;
    private final AuthCookies authCookies;
    private final ObjectMapper objectMapper;

    public SessionAuthenticationFilter(AuthGuard authGuard, AuthCookies authCookies, ObjectMapper objectMapper) {
        this.authGuard = authGuard;
        this.authCookies = authCookies;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = AuthCookies.read(request, AuthCookies.ACCESS_TOKEN).orElse(null);
        String fingerprint = AuthCookies.read(request, AuthCookies.FINGERPRINT).orElse(null);
        GuardDecision decision = authGuard.evaluate(token, fingerprint);

        switch (decision.state()) {
            case AUTHENTICATED -> {
                StudentPrincipal principal = new StudentPrincipal(decision.studentId(), decision.sessionId());
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal, null, List.of(new SimpleGrantedAuthority(ROLE_STUDENT)));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            }
            case SESSION_INVALID -> {
                SecurityContextHolder.clearContext();
                authCookies.clear(request, response);
            }
            case SESSION_UNAVAILABLE -> {
                // 쿠키는 유지: 세션이 죽었는지 알 수 없다.
                writeUnavailable(request, response);
                return;
            }
            default -> SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return path.equals("/auth/request-otp")
                || path.equals("/auth/verify-otp")
                || path.equals("/auth/logout")
                || path.equals("/admin/auth/cleanup")
                || path.startsWith("/actuator");
    }

    private void writeUnavailable(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProblemResponse body = ProblemResponse.of(HttpStatus.SERVICE_UNAVAILABLE, BACKEND_UNAVAILABLE,
                "Authentication is temporarily unavailable.", request.getRequestURI());
        response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
