package org.currencyconverter.rates.exception;

/** Base class for every failure a rate query can surface to the API layer. */
public abstract class CurrencyConverterException extends RuntimeException {

  private final ErrorKind kind;

  protected CurrencyConverterException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected CurrencyConverterException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
