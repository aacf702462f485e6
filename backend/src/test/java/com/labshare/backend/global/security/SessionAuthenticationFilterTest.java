package com.labshare.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.labshare.backend.modules.auth.application.AuthGuard;
import com.labshare.backend.modules.auth.application.GuardDecision;
import com.labshare.backend.modules.auth.application.GuardDecision.State;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticationFilterTest {

    @Mock
    private AuthGuard authGuard;

    private SessionAuthenticationFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private MockFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new SessionAuthenticationFilter(authGuard, new AuthCookies(false, 604_800_000L), new ObjectMapper());
        request = new MockHttpServletRequest("GET", "/submissions");
        request.setServletPath("/submissions");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN, "token"), new Cookie(AuthCookies.FINGERPRINT, "fp"));
        response = new MockHttpServletResponse();
        chain = new MockFilterChain();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void authenticatedSessionInstallsPrincipal() throws Exception {
        UUID studentId = UUID.randomUUID();
        UUID sessionId = UUID.randomUUID();
        when(authGuard.evaluate("token", "fp"))
                .thenReturn(new GuardDecision(State.AUTHENTICATED, studentId, sessionId));

        filter.doFilter(request, response, chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo(new StudentPrincipal(studentId, sessionId));
        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
    }

    @Test
    void invalidSessionClearsCookiesAndContinuesAnonymously() throws Exception {
        when(authGuard.evaluate("token", "fp")).thenReturn(new GuardDecision(State.SESSION_INVALID, null, null));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(response.getHeaders(HttpHeaders.SET_COOKIE))
                .hasSize(2)
                .allSatisfy(header -> assertThat(header).contains("Max-Age=0"));
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void unavailableBackendAnswers503WithoutClearingCookies() throws Exception {
        when(authGuard.evaluate("token", "fp")).thenReturn(new GuardDecision(State.SESSION_UNAVAILABLE, null, null));

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getContentAsString()).contains("AUTH_BACKEND_UNAVAILABLE");
        assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void loginEndpointsAreNotFiltered() throws Exception {
        request = new MockHttpServletRequest("POST", "/auth/verify-otp");
        request.setServletPath("/auth/verify-otp");

        filter.doFilter(request, response, chain);

        verify(authGuard, never()).evaluate(any(), any());
        assertThat(chain.getRequest()).isNotNull();
    }
}
