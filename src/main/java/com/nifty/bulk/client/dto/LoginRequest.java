package com.nifty.bulk.client.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Login body. {@code identifier} is the mobile number for OTP login, the e-mail otherwise;
 * {@code secret} is the OTP or password.
 */
public record LoginRequest(
        @NotBlank(message = "Identifier cannot be blank")
        String identifier,

        @NotBlank(message = "Secret cannot be blank")
        String secret
) {
    @Override
    public String toString() {
        return "LoginRequest[identifier=" + identifier + "]";
    }
}
