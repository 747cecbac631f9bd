package org.currencyconverter.rates.service.query;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Request to convert an amount between two currencies.
 *
 * @param fromCurrency ISO 4217 source currency code
 * @param toCurrency ISO 4217 target currency code
 * @param amount amount of the source currency
 */
public record ConvertCurrencyQuery(
    @NotNull(message = "Source currency is required.")
        @Pattern(
            regexp = QueryConstraints.CURRENCY_CODE_PATTERN,
            message = "Source currency must be a valid 3-letter ISO code.")
        String fromCurrency,
    @NotNull(message = "Target currency is required.")
        @Pattern(
            regexp = QueryConstraints.CURRENCY_CODE_PATTERN,
            message = "Target currency must be a valid 3-letter ISO code.")
        String toCurrency,
    @NotNull(message = "Amount is required.") @Positive(message = "Amount must be positive.")
        BigDecimal amount) {}
