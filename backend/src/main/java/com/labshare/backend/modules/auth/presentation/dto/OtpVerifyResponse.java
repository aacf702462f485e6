package com.labshare.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record OtpVerifyResponse(boolean success, UUID studentId, String email) {
}
