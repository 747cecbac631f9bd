package org.currencyconverter.rates.service.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import jakarta.validation.Validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.currencyconverter.rates.exception.RequestCancelledException;
import org.currencyconverter.rates.exception.ValidationException;
import org.currencyconverter.rates.service.cache.CacheService;
import org.currencyconverter.rates.service.provider.ExchangeRateProvider;
import org.currencyconverter.rates.service.provider.ExchangeRateProviderFactory;

/**
 * Cache-aside execution shared by all rate queries.
 *
 * <p>Every query runs the same sequence:
 *
 * <ol>
 *   <li>validate the query; a rejected query never touches the cache or the provider
 *   <li>look the deterministic cache key up; a hit is returned as is
 *   <li>on a miss, resolve the active provider and fetch from it
 *   <li>store the result under the key with the handler's expiry, then return it
 * </ol>
 *
 * <p>Provider and cache failures propagate unchanged and nothing is cached. If the calling thread
 * is interrupted (request cancelled or timed out) before the provider call or before the cache
 * write, the query stops with a {@link RequestCancelledException}.
 *
 * @param <Q> query type
 * @param <R> result type, stored in and read back from the cache
 */
public abstract class AbstractCachedQueryHandler<Q, R> {

  private static final Logger log = LoggerFactory.getLogger(AbstractCachedQueryHandler.class);

  private final ExchangeRateProviderFactory providerFactory;
  private final CacheService cacheService;
  private final Validator validator;
  private final String activeProvider;
  private final Class<R> resultType;
  private final Duration ttl;

  protected AbstractCachedQueryHandler(
      ExchangeRateProviderFactory providerFactory,
      CacheService cacheService,
      Validator validator,
      String activeProvider,
      Class<R> resultType,
      Duration ttl) {
    this.providerFactory = providerFactory;
    this.cacheService = cacheService;
    this.validator = validator;
    this.activeProvider = activeProvider;
    this.resultType = resultType;
    this.ttl = ttl;
  }

  /**
   * Executes the query.
   *
   * @param query query to execute
   * @return cached or freshly fetched result
   * @throws ValidationException if the query is rejected
   * @throws org.currencyconverter.rates.exception.UnsupportedProviderException if the active
   *     provider is not registered
   * @throws org.currencyconverter.rates.exception.UpstreamException if the provider fails
   * @throws org.currencyconverter.rates.exception.CacheInfrastructureException if the cache store
   *     fails
   * @throws RequestCancelledException if the request was cancelled
   */
  public R handle(Q query) {
    validate(query);

    var cacheKey = cacheKey(query);
    var cached = cacheService.get(cacheKey, resultType);
    if (cached.isPresent()) {
      log.info("Cache hit for {}", cacheKey);
      return cached.get();
    }

    log.info("Cache miss for {} - fetching from provider: {}", cacheKey, activeProvider);
    var provider = providerFactory.createProvider(activeProvider);

    checkNotCancelled(cacheKey);
    var result = fetch(provider, query);

    checkNotCancelled(cacheKey);
    cacheService.set(cacheKey, result, ttl);

    return result;
  }

  /** Builds the cache key; logically identical queries must produce the same key. */
  protected abstract String cacheKey(Q query);

  /** Fetches the result from the provider on a cache miss. */
  protected abstract R fetch(ExchangeRateProvider provider, Q query);

  /**
   * Checks that need more than one field; runs only when all field constraints pass.
   *
   * @param query query with valid individual fields
   * @return rejected fields, empty when the query is valid
   */
  protected List<ValidationException.FieldError> validateFieldCombination(Q query) {
    return List.of();
  }

  private void validate(Q query) {
    if (query == null) {
      throw new ValidationException("Query is required.");
    }

    var errors =
        validator.validate(query).stream()
            .map(
                violation ->
                    new ValidationException.FieldError(
                        violation.getPropertyPath().toString(), violation.getMessage()))
            .sorted(
                Comparator.comparing(ValidationException.FieldError::field)
                    .thenComparing(ValidationException.FieldError::message))
            .collect(Collectors.toCollection(ArrayList::new));

    if (errors.isEmpty()) {
      errors.addAll(validateFieldCombination(query));
    }

    if (!errors.isEmpty()) {
      var message =
          errors.stream()
              .map(error -> error.field() + ": " + error.message())
              .collect(Collectors.joining("; "));
      log.debug("Rejected {}: {}", query.getClass().getSimpleName(), message);
      throw new ValidationException(message, errors);
    }
  }

  private static void checkNotCancelled(String cacheKey) {
    if (Thread.currentThread().isInterrupted()) {
      throw new RequestCancelledException("Request cancelled while resolving " + cacheKey);
    }
  }
}
