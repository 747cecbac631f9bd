package org.currencyconverter.rates.exception;

/** Distinguishable failure kinds surfaced by rate queries. */
public enum ErrorKind {
  /** Request parameters failed validation; never reaches cache or provider. */
  VALIDATION(true),

  /** Configured provider name is not registered. */
  UNSUPPORTED_PROVIDER(true),

  /** Upstream rate provider failed or returned an absent or malformed response. */
  UPSTREAM(false),

  /** Backing cache store is unreachable or returned unreadable data. */
  CACHE_INFRASTRUCTURE(false),

  /** Caller aborted the request before it completed. */
  CANCELLED(false);

  private final boolean clientFault;

  ErrorKind(boolean clientFault) {
    this.clientFault = clientFault;
  }

  public boolean isClientFault() {
    return clientFault;
  }
}
