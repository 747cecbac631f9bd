package org.currencyconverter.rates.service.cache;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.exception.CacheInfrastructureException;
import org.currencyconverter.rates.exception.RequestCancelledException;

/**
 * Redis implementation of CacheService.
 *
 * <p>Values are stored as JSON strings under {@code <key-prefix><key>} so entries stay readable
 * with {@code redis-cli} and never collide with other services sharing the instance. Decimal
 * values keep their exact scale through the round trip.
 */
@Service
public class RedisCacheService implements CacheService {

  private static final Logger log = LoggerFactory.getLogger(RedisCacheService.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  /**
   * Constructs a new RedisCacheService.
   *
   * @param redisTemplate template bound to the shared Redis connection factory
   * @param objectMapper application-wide ObjectMapper with JavaTimeModule registered
   * @param properties service properties providing the key prefix
   */
  public RedisCacheService(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      CurrencyConverterProperties properties) {
    this.redisTemplate = redisTemplate;
    // Copy so cache encoding stays stable if the application-wide mapper is reconfigured
    this.objectMapper = objectMapper.copy();
    this.keyPrefix = properties.getCache().getKeyPrefix();
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    String json;
    try {
      json = redisTemplate.opsForValue().get(keyPrefix + key);
    } catch (DataAccessException e) {
      throw translate("read", key, e);
    }

    if (json == null) {
      log.debug("Cache miss: {}", key);
      return Optional.empty();
    }

    try {
      var value = objectMapper.readValue(json, type);
      log.debug("Retrieved from cache: {}", key);
      return Optional.of(value);
    } catch (JsonProcessingException e) {
      throw new CacheInfrastructureException("Unreadable cache entry: " + key, e);
    }
  }

  @Override
  public <T> void set(String key, T value, Duration ttl) {
    String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CacheInfrastructureException("Unable to serialize cache entry: " + key, e);
    }

    try {
      redisTemplate.opsForValue().set(keyPrefix + key, json, ttl);
    } catch (DataAccessException e) {
      throw translate("write", key, e);
    }

    log.debug("Cached {} with expiry {}", key, ttl);
  }

  private RuntimeException translate(String operation, String key, DataAccessException e) {
    if (Thread.currentThread().isInterrupted() || causedByInterrupt(e)) {
      Thread.currentThread().interrupt();
      return new RequestCancelledException("Cache " + operation + " cancelled: " + key, e);
    }

    log.warn("Cache {} failed for {}: {}", operation, key, e.getMessage());
    return new CacheInfrastructureException("Cache " + operation + " failed: " + key, e);
  }

  private static boolean causedByInterrupt(Throwable t) {
    for (var cause = t; cause != null; cause = cause.getCause()) {
      if (cause instanceof InterruptedException) {
        return true;
      }
    }
    return false;
  }
}
