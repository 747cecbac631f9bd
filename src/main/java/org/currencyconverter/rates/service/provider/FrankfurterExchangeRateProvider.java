package org.currencyconverter.rates.service.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.currencyconverter.rates.client.frankfurter.FrankfurterClient;
import org.currencyconverter.rates.client.frankfurter.response.FrankfurterLatestResponse;
import org.currencyconverter.rates.domain.ExcludedCurrencies;
import org.currencyconverter.rates.domain.HistoricalRateSet;
import org.currencyconverter.rates.domain.RateSnapshot;

/**
 * Frankfurter implementation of ExchangeRateProvider.
 *
 * <p>Fetches rates published by the European Central Bank through the Frankfurter API. Frankfurter
 * has no pagination, so historical series are windowed and paginated locally by {@link
 * HistoricalRatePager}.
 */
@Service
public class FrankfurterExchangeRateProvider implements ExchangeRateProvider {

  public static final String NAME = "frankfurter";

  private static final Logger log = LoggerFactory.getLogger(FrankfurterExchangeRateProvider.class);

  private final FrankfurterClient frankfurterClient;

  /**
   * Constructs a new FrankfurterExchangeRateProvider.
   *
   * @param frankfurterClient The Frankfurter API client
   */
  public FrankfurterExchangeRateProvider(FrankfurterClient frankfurterClient) {
    this.frankfurterClient = frankfurterClient;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public RateSnapshot getLatestRates(String baseCurrency) {
    log.info("Fetching latest rates from Frankfurter - baseCurrency: {}", baseCurrency);

    return toSnapshot(frankfurterClient.getLatest(baseCurrency));
  }

  @Override
  public RateSnapshot convert(String fromCurrency, String toCurrency, BigDecimal amount) {
    log.info(
        "Converting with Frankfurter - from: {}, to: {}, amount: {}",
        fromCurrency,
        toCurrency,
        amount.toPlainString());

    return toSnapshot(frankfurterClient.getConversion(fromCurrency, toCurrency, amount));
  }

  @Override
  public HistoricalRateSet getHistoricalRates(
      String baseCurrency, LocalDate startDate, LocalDate endDate, int page, int pageSize) {
    log.info(
        "Fetching historical rates from Frankfurter - baseCurrency: {}, startDate: {},"
            + " endDate: {}, page: {}, pageSize: {}",
        baseCurrency,
        startDate,
        endDate,
        page,
        pageSize);

    var response = frankfurterClient.getTimeSeries(baseCurrency, startDate, endDate);
    var series = response.rates();

    var pagedRates = HistoricalRatePager.page(series, startDate, endDate, page, pageSize);
    // upstream's raw count, taken before the window and page are applied
    var totalRecords = series.size();

    log.debug(
        "Frankfurter returned {} dated entries, {} kept on page {}",
        totalRecords,
        pagedRates.size(),
        page);

    return new HistoricalRateSet(
        response.amount(),
        baseCurrency,
        startDate,
        endDate,
        page,
        pageSize,
        totalRecords,
        pagedRates);
  }

  private static RateSnapshot toSnapshot(FrankfurterLatestResponse response) {
    return new RateSnapshot(
        response.amount(),
        response.base(),
        response.date(),
        ExcludedCurrencies.strip(response.rates()));
  }
}
