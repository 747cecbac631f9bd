package org.currencyconverter.rates.exception;

/** Thrown when the upstream rate provider fails or returns an unusable response. */
public class UpstreamException extends CurrencyConverterException {

  private final Integer statusCode;

  public UpstreamException(String message) {
    this(message, null, null);
  }

  public UpstreamException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public UpstreamException(String message, Integer statusCode) {
    this(message, statusCode, null);
  }

  private UpstreamException(String message, Integer statusCode, Throwable cause) {
    super(ErrorKind.UPSTREAM, message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the provider, or null when no response was received. */
  public Integer getStatusCode() {
    return statusCode;
  }
}
