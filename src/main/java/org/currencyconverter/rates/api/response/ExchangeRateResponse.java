package org.currencyconverter.rates.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

import org.currencyconverter.rates.domain.RateSnapshot;

@Schema(description = "Exchange rates for one base currency on one date")
public record ExchangeRateResponse(
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
            description = "Date the rates were published",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-03")
        LocalDate date,
    @Schema(
            description =
                "Currency code to rate (or converted amount). TRY, PLN, THB and MXN are never"
                    + " included",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "{\"GBP\": 0.8292, \"USD\": 1.0321}")
        Map<String, BigDecimal> rates) {

  public static ExchangeRateResponse from(RateSnapshot snapshot) {
    return new ExchangeRateResponse(
        snapshot.amount(), snapshot.baseCurrency(), snapshot.date(), snapshot.rates());
  }
}
