package org.currencyconverter.rates.api.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

import org.currencyconverter.rates.exception.ValidationException;

@Schema(description = "Error details returned for every failed request")
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "VALIDATION")
        String type,
    @Schema(
            description = "Human readable description",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "baseCurrency: Base currency must be a valid 3-letter ISO code.")
        String message,
    @Schema(description = "Rejected request fields, present for validation errors")
        List<FieldErrorResponse> fieldErrors) {

  public static ApiErrorResponse of(String type, String message) {
    return new ApiErrorResponse(type, message, List.of());
  }

  public static ApiErrorResponse of(ValidationException exception) {
    var fieldErrors =
        exception.getFieldErrors().stream()
            .map(error -> new FieldErrorResponse(error.field(), error.message()))
            .toList();
    return new ApiErrorResponse(exception.getKind().name(), exception.getMessage(), fieldErrors);
  }

  @Schema(description = "A single rejected request field")
  public record FieldErrorResponse(
      @Schema(example = "baseCurrency") String field,
      @Schema(example = "Base currency must be a valid 3-letter ISO code.") String message) {}
}
