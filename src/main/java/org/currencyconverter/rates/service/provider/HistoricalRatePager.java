package org.currencyconverter.rates.service.provider;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import org.currencyconverter.rates.domain.ExcludedCurrencies;

/**
 * Windows, sorts and paginates a dated rate series in memory.
 *
 * <p>Upstream series are small (one entry per publishing day), so the whole series is processed
 * per request.
 */
public final class HistoricalRatePager {

  private HistoricalRatePager() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  /**
   * Returns one page of the series.
   *
   * <p>Entries are kept only when their date lies in {@code [startDate, endDate]}, ordered
   * ascending by date, then {@code pageSize} entries are taken after skipping {@code (page - 1) *
   * pageSize}. Excluded currencies are removed from every retained date.
   *
   * @param series date to (currency code to rate), in any order, may be null
   * @param startDate first date of the window (inclusive)
   * @param endDate last date of the window (inclusive)
   * @param page 1-based page number
   * @param pageSize dates per page
   * @return ordered page, empty when the page lies past the end of the window
   */
  public static Map<LocalDate, Map<String, BigDecimal>> page(
      Map<LocalDate, Map<String, BigDecimal>> series,
      LocalDate startDate,
      LocalDate endDate,
      int page,
      int pageSize) {
    var rv = new LinkedHashMap<LocalDate, Map<String, BigDecimal>>();
    if (series == null || series.isEmpty()) {
      return rv;
    }

    long offset = (long) (page - 1) * pageSize;

    series.entrySet().stream()
        .filter(entry -> entry.getKey() != null)
        .filter(entry -> !entry.getKey().isBefore(startDate) && !entry.getKey().isAfter(endDate))
        .sorted(Map.Entry.comparingByKey())
        .skip(offset)
        .limit(pageSize)
        .forEach(entry -> rv.put(entry.getKey(), ExcludedCurrencies.strip(entry.getValue())));

    return rv;
  }
}
