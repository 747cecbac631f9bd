package org.currencyconverter.rates.exception;

import java.util.List;

/** Thrown when query parameters are rejected before any cache or provider access. */
public class ValidationException extends CurrencyConverterException {

  private final List<FieldError> fieldErrors;

  public ValidationException(String message) {
    this(message, List.of());
  }

  public ValidationException(String message, List<FieldError> fieldErrors) {
    super(ErrorKind.VALIDATION, message);
    this.fieldErrors = List.copyOf(fieldErrors);
  }

  public List<FieldError> getFieldErrors() {
    return fieldErrors;
  }

  /**
   * A single rejected field.
   *
   * @param field name of the query field
   * @param message reason the value was rejected
   */
  public record FieldError(String field, String message) {}
}
