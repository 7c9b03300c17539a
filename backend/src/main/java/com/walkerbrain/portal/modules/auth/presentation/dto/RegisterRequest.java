package com.walkerbrain.portal.modules.auth.presentation.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email is malformed") String email,
        @NotBlank(message = "password is required") @Size(min = 6, max = 128, message = "password must be 6-128 characters") String password,
        @NotBlank(message = "confirmPassword is required") String confirmPassword,
        @NotBlank(message = "displayName is required") @Size(max = 100, message = "displayName is too long") String displayName
) {

    @AssertTrue(message = "Passwords do not match.")
    public boolean isPasswordConfirmed() {
        return password == null || password.equals(confirmPassword);
    }
}
