package org.currencyconverter.rates.service.query;

import java.time.LocalDate;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Request for one page of historical rates.
 *
 * @param baseCurrency ISO 4217 base currency code
 * @param startDate first date of the window (inclusive)
 * @param endDate last date of the window (inclusive)
 * @param page 1-based page number
 * @param pageSize dates per page
 */
public record HistoricalRatesQuery(
    @NotNull(message = "Base currency is required.")
        @Pattern(
            regexp = QueryConstraints.CURRENCY_CODE_PATTERN,
            message = "Base currency must be a valid 3-letter ISO code.")
        String baseCurrency,
    @NotNull(message = "Start date is required.") LocalDate startDate,
    @NotNull(message = "End date is required.") LocalDate endDate,
    @Min(value = 1, message = "Page must be a positive integer.") int page,
    @Min(value = 1, message = "Page size must be between 1 and 100.")
        @Max(value = QueryConstraints.MAX_PAGE_SIZE, message = "Page size must be between 1 and 100.")
        int pageSize) {

  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_PAGE_SIZE = 10;

  public HistoricalRatesQuery(String baseCurrency, LocalDate startDate, LocalDate endDate) {
    this(baseCurrency, startDate, endDate, DEFAULT_PAGE, DEFAULT_PAGE_SIZE);
  }
}
