package com.labshare.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<StudentPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof StudentPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static StudentPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static UUID getCurrentStudentId() {
        return getCurrentPrincipal().studentId();
    }
}
