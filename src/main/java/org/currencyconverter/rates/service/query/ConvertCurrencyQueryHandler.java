package org.currencyconverter.rates.service.query;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Validator;

import org.springframework.stereotype.Service;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.domain.ExcludedCurrencies;
import org.currencyconverter.rates.domain.RateSnapshot;
import org.currencyconverter.rates.exception.ValidationException;
import org.currencyconverter.rates.service.cache.CacheService;
import org.currencyconverter.rates.service.provider.ExchangeRateProvider;
import org.currencyconverter.rates.service.provider.ExchangeRateProviderFactory;

/**
 * Converts an amount between two currencies.
 *
 * <p>Cache key: {@code convert:{from}:{to}:{amount}} with the amount in plain notation and without
 * trailing zeros, so {@code 100}, {@code 100.0} and {@code 100.00} share {@code
 * convert:EUR:USD:100}. Entries expire after {@code currency-converter.cache.conversion-ttl} (1
 * hour by default).
 *
 * <p>Excluded currencies are rejected as either side of the conversion.
 */
@Service
public class ConvertCurrencyQueryHandler
    extends AbstractCachedQueryHandler<ConvertCurrencyQuery, RateSnapshot> {

  public ConvertCurrencyQueryHandler(
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
        properties.getCache().getConversionTtl());
  }

  @Override
  protected String cacheKey(ConvertCurrencyQuery query) {
    return "convert:"
        + query.fromCurrency()
        + ":"
        + query.toCurrency()
        + ":"
        + query.amount().stripTrailingZeros().toPlainString();
  }

  @Override
  protected RateSnapshot fetch(ExchangeRateProvider provider, ConvertCurrencyQuery query) {
    return provider.convert(query.fromCurrency(), query.toCurrency(), query.amount());
  }

  @Override
  protected List<ValidationException.FieldError> validateFieldCombination(
      ConvertCurrencyQuery query) {
    var errors = new ArrayList<ValidationException.FieldError>();
    var message = "Currencies " + ExcludedCurrencies.DISPLAY_LIST + " are not supported.";

    if (ExcludedCurrencies.isExcluded(query.fromCurrency())) {
      errors.add(new ValidationException.FieldError("fromCurrency", message));
    }
    if (ExcludedCurrencies.isExcluded(query.toCurrency())) {
      errors.add(new ValidationException.FieldError("toCurrency", message));
    }

    return errors;
  }
}
