package org.currencyconverter.rates.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Credentials exchanged for a bearer token")
public record TokenRequest(
    @Schema(
            description = "Username",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "test")
        @NotBlank(message = "Username is required.")
        String username,
    @Schema(
            description = "Password",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "password")
        @NotBlank(message = "Password is required.")
        String password,
    @Schema(
            description = "Role written to the token",
            requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"User", "Admin"},
            example = "User")
        @NotBlank(message = "Role is required.")
        @Pattern(regexp = "(?i)^(User|Admin)$", message = "Role must be User or Admin.")
        String role) {}
