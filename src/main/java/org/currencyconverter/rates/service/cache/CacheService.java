package org.currencyconverter.rates.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * String-keyed cache with a per-entry expiry.
 *
 * <p>A miss is not an error. Failures of the backing store are never hidden: they surface as
 * {@link org.currencyconverter.rates.exception.CacheInfrastructureException}.
 */
public interface CacheService {

  /**
   * Reads an entry.
   *
   * @param key cache key, without any store-specific prefix
   * @param type type the entry was stored as
   * @return the entry, or empty on a miss
   */
  <T> Optional<T> get(String key, Class<T> type);

  /**
   * Writes an entry, replacing any previous value under the same key.
   *
   * @param key cache key, without any store-specific prefix
   * @param value value to store, not null
   * @param ttl time until the entry expires
   */
  <T> void set(String key, T value, Duration ttl);
}
