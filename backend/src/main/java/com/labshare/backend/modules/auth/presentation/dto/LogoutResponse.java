package com.labshare.backend.modules.auth.presentation.dto;

public record LogoutResponse(boolean success, int revokedSessions) {

    public static LogoutResponse single() {
        return new LogoutResponse(true, 0);
    }
}
