package org.currencyconverter.rates.service.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.currencyconverter.rates.domain.HistoricalRateSet;
import org.currencyconverter.rates.domain.RateSnapshot;

/**
 * Provider interface for fetching exchange rates from an external data source.
 *
 * <p>Implementations never return rates for an excluded currency (see {@link
 * org.currencyconverter.rates.domain.ExcludedCurrencies}) and must be safe for concurrent use.
 */
public interface ExchangeRateProvider {

  /**
   * Name this provider is registered under, matched case-insensitively by {@link
   * ExchangeRateProviderFactory}.
   *
   * @return registry name
   */
  String name();

  /**
   * Retrieves the most recent rates for a base currency.
   *
   * @param baseCurrency ISO 4217 base currency code
   * @return latest rates
   * @throws org.currencyconverter.rates.exception.UpstreamException if the data source fails or
   *     returns an unusable response
   */
  RateSnapshot getLatestRates(String baseCurrency);

  /**
   * Converts an amount between two currencies at the most recent rate.
   *
   * @param fromCurrency ISO 4217 source currency code
   * @param toCurrency ISO 4217 target currency code
   * @param amount amount of the source currency, passed through without rounding
   * @return conversion result, with the converted amount as the rate of {@code toCurrency}
   * @throws org.currencyconverter.rates.exception.UpstreamException if the data source fails or
   *     returns an unusable response
   */
  RateSnapshot convert(String fromCurrency, String toCurrency, BigDecimal amount);

  /**
   * Retrieves one page of the dated rate series between two dates.
   *
   * @param baseCurrency ISO 4217 base currency code
   * @param startDate first date of the window (inclusive)
   * @param endDate last date of the window (inclusive)
   * @param page 1-based page number
   * @param pageSize dates per page
   * @return the requested page, ordered ascending by date
   * @throws org.currencyconverter.rates.exception.UpstreamException if the data source fails or
   *     returns an unusable response
   */
  HistoricalRateSet getHistoricalRates(
      String baseCurrency, LocalDate startDate, LocalDate endDate, int page, int pageSize);
}
