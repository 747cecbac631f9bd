package org.currencyconverter.rates.service.provider;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.currencyconverter.rates.exception.UnsupportedProviderException;

/**
 * Resolves exchange rate providers by name.
 *
 * <p>The registry is built once from every {@link ExchangeRateProvider} bean in the context and
 * never changes afterwards. Lookups ignore case.
 */
@Component
public class ExchangeRateProviderFactory {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateProviderFactory.class);

  private final Map<String, ExchangeRateProvider> providersByName;

  public ExchangeRateProviderFactory(List<ExchangeRateProvider> providers) {
    var registry = new TreeMap<String, ExchangeRateProvider>();
    for (var provider : providers) {
      var key = normalize(provider.name());
      var existing = registry.putIfAbsent(key, provider);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate exchange rate provider name: "
                + provider.name()
                + " ("
                + existing.getClass().getSimpleName()
                + ", "
                + provider.getClass().getSimpleName()
                + ")");
      }
    }

    this.providersByName = Collections.unmodifiableMap(registry);
    log.info("Registered exchange rate providers: {}", providersByName.keySet());
  }

  /**
   * Returns the provider registered under the given name.
   *
   * @param providerName provider name, any case
   * @return the registered provider
   * @throws UnsupportedProviderException if no provider is registered under the name
   */
  public ExchangeRateProvider createProvider(String providerName) {
    var provider = providerName == null ? null : providersByName.get(normalize(providerName));
    if (provider == null) {
      throw new UnsupportedProviderException(providerName);
    }

    return provider;
  }

  public Set<String> getProviderNames() {
    return providersByName.keySet();
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
