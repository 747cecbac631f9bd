package org.currencyconverter.rates.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

import org.currencyconverter.rates.domain.HistoricalRateSet;

@Schema(description = "One page of historical exchange rates")
public record HistoricalRatesResponse(
    @Schema(
            description = "Amount of the base currency the rates are quoted for",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1.0")
        BigDecimal amount,
    @Schema(
            description = "Base currency all rates are relative to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String baseCurrency,
    @Schema(
            description = "First requested date (inclusive)",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-01")
        LocalDate startDate,
    @Schema(
            description = "Last requested date (inclusive)",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-31")
        LocalDate endDate,
    @Schema(description = "1-based page number", requiredMode = Schema.RequiredMode.REQUIRED)
        int page,
    @Schema(description = "Dates per page", requiredMode = Schema.RequiredMode.REQUIRED)
        int pageSize,
    @Schema(
            description = "Dated entries the provider returned for the requested window",
            requiredMode = Schema.RequiredMode.REQUIRED)
        int totalRecords,
    @Schema(
            description = "Pages available at the requested page size",
            requiredMode = Schema.RequiredMode.REQUIRED)
        int totalPages,
    @Schema(
            description = "Date to (currency code to rate), ascending by date",
            requiredMode = Schema.RequiredMode.REQUIRED)
        Map<LocalDate, Map<String, BigDecimal>> rates) {

  public static HistoricalRatesResponse from(HistoricalRateSet rateSet) {
    return new HistoricalRatesResponse(
        rateSet.amount(),
        rateSet.baseCurrency(),
        rateSet.startDate(),
        rateSet.endDate(),
        rateSet.page(),
        rateSet.pageSize(),
        rateSet.totalRecords(),
        rateSet.totalPages(),
        rateSet.rates());
  }
}
