package org.currencyconverter.rates.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.currencyconverter.rates.security.TokenService.IssuedToken;

@Schema(description = "Issued bearer token")
public record TokenResponse(
    @Schema(
            description = "Signed JWT to send as 'Authorization: Bearer <token>'",
            requiredMode = Schema.RequiredMode.REQUIRED)
        String token,
    @Schema(
            description = "Instant the token expires",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-01T13:00:00Z")
        Instant expiresAt) {

  public static TokenResponse from(IssuedToken issuedToken) {
    return new TokenResponse(issuedToken.token(), issuedToken.expiresAt());
  }
}
