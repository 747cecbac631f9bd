package org.currencyconverter.rates.service.query;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Validator;

import org.springframework.stereotype.Service;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.domain.HistoricalRateSet;
import org.currencyconverter.rates.exception.ValidationException;
import org.currencyconverter.rates.service.cache.CacheService;
import org.currencyconverter.rates.service.provider.ExchangeRateProvider;
import org.currencyconverter.rates.service.provider.ExchangeRateProviderFactory;

/**
 * Serves one page of historical rates.
 *
 * <p>Cache key: {@code historical:{base}:{startDate}:{endDate}:{page}:{pageSize}} with ISO
 * ({@code yyyy-MM-dd}) dates, e.g. {@code historical:EUR:2025-01-01:2025-01-05:1:10}. Entries
 * expire after {@code currency-converter.cache.historical-rates-ttl} (24 hours by default).
 *
 * <p>Neither date may lie after today and the start date may not be after the end date.
 */
@Service
public class HistoricalRatesQueryHandler
    extends AbstractCachedQueryHandler<HistoricalRatesQuery, HistoricalRateSet> {

  private final Clock clock;

  public HistoricalRatesQueryHandler(
      ExchangeRateProviderFactory providerFactory,
      CacheService cacheService,
      Validator validator,
      CurrencyConverterProperties properties,
      Clock clock) {
    super(
        providerFactory,
        cacheService,
        validator,
        properties.getActiveProvider(),
        HistoricalRateSet.class,
        properties.getCache().getHistoricalRatesTtl());
    this.clock = clock;
  }

  @Override
  protected String cacheKey(HistoricalRatesQuery query) {
    return "historical:"
        + query.baseCurrency()
        + ":"
        + query.startDate().format(DateTimeFormatter.ISO_LOCAL_DATE)
        + ":"
        + query.endDate().format(DateTimeFormatter.ISO_LOCAL_DATE)
        + ":"
        + query.page()
        + ":"
        + query.pageSize();
  }

  @Override
  protected HistoricalRateSet fetch(ExchangeRateProvider provider, HistoricalRatesQuery query) {
    return provider.getHistoricalRates(
        query.baseCurrency(), query.startDate(), query.endDate(), query.page(), query.pageSize());
  }

  @Override
  protected List<ValidationException.FieldError> validateFieldCombination(
      HistoricalRatesQuery query) {
    var errors = new ArrayList<ValidationException.FieldError>();
    var today = LocalDate.now(clock);

    if (query.startDate().isAfter(today)) {
      errors.add(new ValidationException.FieldError("startDate", "Dates cannot be in the future."));
    }
    if (query.endDate().isAfter(today)) {
      errors.add(new ValidationException.FieldError("endDate", "Dates cannot be in the future."));
    }
    if (query.startDate().isAfter(query.endDate())) {
      errors.add(
          new ValidationException.FieldError(
              "endDate", "EndDate must be greater than or equal to StartDate."));
    }

    return errors;
  }
}
