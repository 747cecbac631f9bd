package org.currencyconverter.rates.exception;

public class UnsupportedProviderException extends CurrencyConverterException {

  private final String providerName;

  public UnsupportedProviderException(String providerName) {
    super(ErrorKind.UNSUPPORTED_PROVIDER, "Provider " + providerName + " not supported.");
    this.providerName = providerName;
  }

  public String getProviderName() {
    return providerName;
  }
}
