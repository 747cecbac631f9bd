package org.currencyconverter.rates.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import org.currencyconverter.rates.exception.UpstreamException;

/**
 * Circuit breaker guarding calls to the Frankfurter API.
 *
 * <p>Every attempt, including 429 retries, is recorded. Server errors, rate limiting and transport
 * failures count as failures; other 4xx answers mean Frankfurter is healthy and count as successes.
 *
 * <pre>
 * CLOSED -> OPEN       failure rate reaches the threshold over the sliding window
 * OPEN -> HALF_OPEN    after the configured wait
 * HALF_OPEN -> CLOSED  trial calls succeed
 * HALF_OPEN -> OPEN    trial calls fail
 * </pre>
 */
@Configuration
public class FrankfurterResilienceConfig {

  public static final String FRANKFURTER_CIRCUIT_BREAKER = "frankfurter";

  private static final Logger log = LoggerFactory.getLogger(FrankfurterResilienceConfig.class);

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(CurrencyConverterProperties properties) {
    var breakerConfig = properties.getFrankfurter().getCircuitBreaker();

    var config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(breakerConfig.getSlidingWindowSize())
            .minimumNumberOfCalls(breakerConfig.getMinimumNumberOfCalls())
            .failureRateThreshold(breakerConfig.getFailureRateThreshold())
            .waitDurationInOpenState(breakerConfig.getWaitDurationInOpenState())
            .permittedNumberOfCallsInHalfOpenState(
                breakerConfig.getPermittedCallsInHalfOpenState())
            .recordException(FrankfurterResilienceConfig::isFailure)
            .build();

    return CircuitBreakerRegistry.of(config);
  }

  @Bean
  public CircuitBreaker frankfurterCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
    var circuitBreaker = circuitBreakerRegistry.circuitBreaker(FRANKFURTER_CIRCUIT_BREAKER);
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                log.warn(
                    "Frankfurter circuit breaker {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));

    return circuitBreaker;
  }

  static boolean isFailure(Throwable t) {
    if (t instanceof UpstreamException ue && ue.getStatusCode() != null) {
      var status = ue.getStatusCode();
      return status >= 500 || status == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    return true;
  }
}
