package org.currencyconverter.rates.domain;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Currencies that are never returned by any rate query. */
public final class ExcludedCurrencies {

  public static final Set<String> CODES = Set.of("TRY", "PLN", "THB", "MXN");

  /** Human-readable list used in validation messages. */
  public static final String DISPLAY_LIST = "TRY, PLN, THB, MXN";

  private ExcludedCurrencies() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  public static boolean isExcluded(String currencyCode) {
    return currencyCode != null && CODES.contains(currencyCode.toUpperCase(Locale.ROOT));
  }

  /**
   * Returns a copy of the given rates without any excluded currency.
   *
   * @param rates currency code to rate mapping, may be null
   * @return filtered copy ordered by currency code
   */
  public static Map<String, BigDecimal> strip(Map<String, BigDecimal> rates) {
    var rv = new TreeMap<String, BigDecimal>();
    if (rates == null) {
      return rv;
    }

    rates.forEach(
        (code, rate) -> {
          if (!isExcluded(code)) {
            rv.put(code, rate);
          }
        });
    return rv;
  }
}
