package com.labshare.backend.modules.auth.presentation.dto;

public record OtpRequestResponse(boolean success, long expiresInSeconds) {
}
