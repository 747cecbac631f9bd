package org.currencyconverter.rates.api;

import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.currencyconverter.rates.api.response.ApiErrorResponse;
import org.currencyconverter.rates.exception.CurrencyConverterException;
import org.currencyconverter.rates.exception.ErrorKind;
import org.currencyconverter.rates.exception.RequestCancelledException;
import org.currencyconverter.rates.exception.ValidationException;

/**
 * Maps failures to HTTP responses.
 *
 * <p>Every {@link ErrorKind} has a fixed status. Cancelled requests get status 499 and no body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Non-standard status used when the caller went away before the response was ready. */
  public static final int CLIENT_CLOSED_REQUEST = 499;

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException exception) {
    log.warn("Validation failed: {}", exception.getMessage());

    return ResponseEntity.status(statusFor(exception.getKind()))
        .body(ApiErrorResponse.of(exception));
  }

  @ExceptionHandler(RequestCancelledException.class)
  public ResponseEntity<Void> handleCancelled(RequestCancelledException exception) {
    log.info("Request cancelled: {}", exception.getMessage());

    return ResponseEntity.status(CLIENT_CLOSED_REQUEST).build();
  }

  @ExceptionHandler(CurrencyConverterException.class)
  public ResponseEntity<ApiErrorResponse> handleCurrencyConverter(
      CurrencyConverterException exception) {
    var kind = exception.getKind();
    if (kind.isClientFault()) {
      log.warn("{}: {}", kind, exception.getMessage());
    } else {
      log.error("{}: {}", kind, exception.getMessage(), exception);
    }

    return ResponseEntity.status(statusFor(kind))
        .body(ApiErrorResponse.of(kind.name(), exception.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidBody(
      MethodArgumentNotValidException exception) {
    var fieldErrors =
        exception.getBindingResult().getFieldErrors().stream()
            .map(
                error ->
                    new ValidationException.FieldError(
                        error.getField(), error.getDefaultMessage()))
            .sorted(Comparator.comparing(ValidationException.FieldError::field))
            .toList();

    return handleValidation(new ValidationException(joinMessages(fieldErrors), fieldErrors));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException exception) {
    var fieldError =
        new ValidationException.FieldError(
            exception.getName(), "Invalid value '" + exception.getValue() + "'.");

    return handleValidation(
        new ValidationException(joinMessages(List.of(fieldError)), List.of(fieldError)));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(
      HttpMessageNotReadableException exception) {
    return handleValidation(new ValidationException("Request body is missing or malformed."));
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthentication(
      AuthenticationException exception) {
    log.warn("Authentication failed: {}", exception.getMessage());

    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(ApiErrorResponse.of(HttpStatus.UNAUTHORIZED.name(), exception.getMessage()));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(AccessDeniedException exception) {
    log.warn("Access denied: {}", exception.getMessage());

    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ApiErrorResponse.of(HttpStatus.FORBIDDEN.name(), "Access denied"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception exception) {
    // framework exceptions (missing parameter, unknown path, async timeout) carry their own status
    if (exception instanceof ErrorResponse errorResponse) {
      var status = errorResponse.getStatusCode();
      log.warn("Request failed with status {}: {}", status.value(), exception.getMessage());

      return ResponseEntity.status(status)
          .body(ApiErrorResponse.of(typeFor(status), errorResponse.getBody().getDetail()));
    }

    log.error("Unexpected error", exception);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
  }

  static HttpStatusCode statusFor(ErrorKind kind) {
    return switch (kind) {
      case VALIDATION, UNSUPPORTED_PROVIDER -> HttpStatus.BAD_REQUEST;
      case UPSTREAM -> HttpStatus.BAD_GATEWAY;
      case CACHE_INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
      case CANCELLED -> HttpStatusCode.valueOf(CLIENT_CLOSED_REQUEST);
    };
  }

  private static String typeFor(HttpStatusCode status) {
    if (status.value() == HttpStatus.BAD_REQUEST.value()) {
      return ErrorKind.VALIDATION.name();
    }

    var resolved = HttpStatus.resolve(status.value());
    return resolved != null ? resolved.name() : String.valueOf(status.value());
  }

  private static String joinMessages(List<ValidationException.FieldError> fieldErrors) {
    return String.join(
        "; ",
        fieldErrors.stream().map(error -> error.field() + ": " + error.message()).toList());
  }
}
