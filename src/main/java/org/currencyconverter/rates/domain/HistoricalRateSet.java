package org.currencyconverter.rates.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One page of a dated exchange rate series.
 *
 * <p>{@code rates} is always ordered ascending by date. {@code totalRecords} is the number of
 * dated entries reported by the upstream provider for the whole requested window.
 *
 * @param amount amount of the base currency the rates are quoted for
 * @param baseCurrency ISO 4217 code all rates are relative to
 * @param startDate first requested date (inclusive)
 * @param endDate last requested date (inclusive)
 * @param page 1-based page number
 * @param pageSize maximum number of dates per page
 * @param totalRecords dated entries available before pagination
 * @param rates date to (currency code to rate)
 */
public record HistoricalRateSet(
    BigDecimal amount,
    String baseCurrency,
    LocalDate startDate,
    LocalDate endDate,
    int page,
    int pageSize,
    int totalRecords,
    Map<LocalDate, Map<String, BigDecimal>> rates) {

  public HistoricalRateSet {
    var sorted = new TreeMap<LocalDate, Map<String, BigDecimal>>();
    if (rates != null) {
      rates.forEach(
          (date, dayRates) ->
              sorted.put(
                  date,
                  dayRates == null
                      ? Map.of()
                      : Collections.unmodifiableMap(new TreeMap<>(dayRates))));
    }
    rates = Collections.unmodifiableMap(sorted);
  }

  /** Number of pages needed to show {@code totalRecords} entries at {@code pageSize} per page. */
  public int totalPages() {
    if (pageSize <= 0) {
      return 0;
    }
    return (totalRecords + pageSize - 1) / pageSize;
  }
}
