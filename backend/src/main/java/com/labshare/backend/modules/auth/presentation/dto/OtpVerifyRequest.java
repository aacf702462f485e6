package com.labshare.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * The code format is checked by the service so that every bad code gets the same answer.
 */
public record OtpVerifyRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotBlank(message = "code is required") String code
) {
}
