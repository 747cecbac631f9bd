package org.currencyconverter.rates.exception;

/**
 * Thrown when the calling request was cancelled or timed out while the query was in flight.
 *
 * <p>The interrupt flag of the current thread is left set.
 */
public class RequestCancelledException extends CurrencyConverterException {

  public RequestCancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }

  public RequestCancelledException(String message, Throwable cause) {
    super(ErrorKind.CANCELLED, message, cause);
  }
}
