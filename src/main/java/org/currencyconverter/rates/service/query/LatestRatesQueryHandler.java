package org.currencyconverter.rates.service.query;

import jakarta.validation.Validator;

import org.springframework.stereotype.Service;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.domain.RateSnapshot;
import org.currencyconverter.rates.service.cache.CacheService;
import org.currencyconverter.rates.service.provider.ExchangeRateProvider;
import org.currencyconverter.rates.service.provider.ExchangeRateProviderFactory;

/**
 * Serves the latest rates of a base currency.
 *
 * <p>Cache key: {@code rates:latest:{baseCurrency}}, e.g. {@code rates:latest:EUR}. Entries expire
 * after {@code currency-converter.cache.latest-rates-ttl} (1 hour by default).
 */
@Service
public class LatestRatesQueryHandler
    extends AbstractCachedQueryHandler<LatestRatesQuery, RateSnapshot> {

  public LatestRatesQueryHandler(
      ExchangeRateProviderFactory providerFactory,
      CacheService cacheService,
      Validator validator,
      CurrencyConverterProperties properties) {
    super(
        providerFactory,
        cacheService,
        validator,
        properties.getActiveProvider(),
        RateSnapshot.class,
        properties.getCache().getLatestRatesTtl());
  }

  @Override
  protected String cacheKey(LatestRatesQuery query) {
    return "rates:latest:" + query.baseCurrency();
  }

  @Override
  protected RateSnapshot fetch(ExchangeRateProvider provider, LatestRatesQuery query) {
    return provider.getLatestRates(query.baseCurrency());
  }
}
