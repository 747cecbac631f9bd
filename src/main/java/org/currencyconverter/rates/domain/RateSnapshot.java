package org.currencyconverter.rates.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exchange rates for one base currency on one date.
 *
 * @param amount amount of the base currency the rates are quoted for (1 for plain rate lookups)
 * @param baseCurrency ISO 4217 code all rates are relative to
 * @param date date the rates were published
 * @param rates currency code to rate, ordered by currency code
 */
public record RateSnapshot(
    BigDecimal amount, String baseCurrency, LocalDate date, Map<String, BigDecimal> rates) {

  public RateSnapshot {
    rates = rates == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rates));
  }
}
