package org.currencyconverter.rates.exception;

public class CacheInfrastructureException extends CurrencyConverterException {

  public CacheInfrastructureException(String message, Throwable cause) {
    super(ErrorKind.CACHE_INFRASTRUCTURE, message, cause);
  }
}
