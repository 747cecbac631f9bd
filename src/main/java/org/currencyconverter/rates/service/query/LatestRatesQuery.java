package org.currencyconverter.rates.service.query;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Request for the most recent rates of a base currency.
 *
 * @param baseCurrency ISO 4217 base currency code
 */
public record LatestRatesQuery(
    @NotNull(message = "Base currency is required.")
        @Pattern(
            regexp = QueryConstraints.CURRENCY_CODE_PATTERN,
            message = "Base currency must be a valid 3-letter ISO code.")
        String baseCurrency) {}
