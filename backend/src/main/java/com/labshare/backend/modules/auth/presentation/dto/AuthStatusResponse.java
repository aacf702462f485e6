package com.labshare.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthStatusResponse(boolean authenticated, StudentSummary student) {

    public static AuthStatusResponse anonymous() {
        return new AuthStatusResponse(false, null);
    }

    public record StudentSummary(UUID id, String name, String email) {
    }
}
