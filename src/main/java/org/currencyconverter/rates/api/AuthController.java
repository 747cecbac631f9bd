package org.currencyconverter.rates.api;

import jakarta.validation.Valid;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.currencyconverter.rates.api.request.TokenRequest;
import org.currencyconverter.rates.api.response.ApiErrorResponse;
import org.currencyconverter.rates.api.response.TokenResponse;
import org.currencyconverter.rates.security.Role;
import org.currencyconverter.rates.security.TokenService;

@Tag(name = "Authentication", description = "Bearer token issuance")
@RestController
@RequestMapping(path = "/api/v1/auth")
public class AuthController {

  private final TokenService tokenService;

  public AuthController(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @Operation(
      summary = "Issue a bearer token",
      description = "Exchanges the demo credentials for a signed JWT carrying the requested role")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = TokenResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Missing field or unknown role",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "401",
            description = "Invalid credentials",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/token", consumes = "application/json", produces = "application/json")
  public TokenResponse issueToken(@Valid @RequestBody TokenRequest request) {
    var role = Role.fromClaimValue(request.role());

    return TokenResponse.from(
        tokenService.issueToken(request.username(), request.password(), role));
  }
}
