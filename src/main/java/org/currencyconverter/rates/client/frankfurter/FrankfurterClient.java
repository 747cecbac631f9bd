package org.currencyconverter.rates.client.frankfurter;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import org.currencyconverter.rates.client.frankfurter.response.FrankfurterErrorResponse;
import org.currencyconverter.rates.client.frankfurter.response.FrankfurterLatestResponse;
import org.currencyconverter.rates.client.frankfurter.response.FrankfurterTimeSeriesResponse;
import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.exception.RequestCancelledException;
import org.currencyconverter.rates.exception.UpstreamException;

/**
 * HTTP client for the Frankfurter exchange rate API.
 *
 * <p>Rate-limited responses (HTTP 429) are retried with exponential backoff; every other failure is
 * surfaced immediately as an {@link UpstreamException}. Every attempt passes through the
 * Frankfurter circuit breaker; while it is open, calls fail fast with an {@link UpstreamException}
 * without reaching the API. An interrupted calling thread surfaces as {@link
 * RequestCancelledException}.
 */
@Component
public class FrankfurterClient {

  private static final Logger log = LoggerFactory.getLogger(FrankfurterClient.class);

  private static final String USER_AGENT = "CurrencyConverterClient/1.0";

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private static final String INVALID_RESPONSE_MESSAGE = "Invalid response from Frankfurter API";

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration timeout;
  private final CurrencyConverterProperties.Retry retry;
  private final CircuitBreaker circuitBreaker;

  public FrankfurterClient(
      WebClient.Builder webClientBuilder,
      CurrencyConverterProperties properties,
      ObjectMapper objectMapper,
      CircuitBreaker frankfurterCircuitBreaker) {

    var frankfurterConfig = properties.getFrankfurter();

    this.webClient =
        webClientBuilder
            .baseUrl(frankfurterConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.objectMapper = objectMapper;
    this.timeout = Duration.ofSeconds(frankfurterConfig.getTimeoutSeconds());
    this.retry = frankfurterConfig.getRetry();
    this.circuitBreaker = frankfurterCircuitBreaker;

    log.info("FrankfurterClient initialized with base URL: {}", frankfurterConfig.getBaseUrl());
  }

  /**
   * Fetches the most recent rates for a base currency.
   *
   * @param baseCurrency ISO 4217 base currency code
   * @return parsed response, never null
   * @throws UpstreamException if the API fails or returns no parseable body
   */
  public FrankfurterLatestResponse getLatest(String baseCurrency) {
    var url = new StringBuilder("/latest").append("?from=").append(encode(baseCurrency));
    log.info("Requesting Frankfurter latest rates - from: {}", baseCurrency);

    return requireComplete(fetch(url.toString(), FrankfurterLatestResponse.class), url);
  }

  /**
   * Converts an amount between two currencies at the most recent rate.
   *
   * @param fromCurrency ISO 4217 source currency code
   * @param toCurrency ISO 4217 target currency code
   * @param amount amount of the source currency
   * @return parsed response, never null
   * @throws UpstreamException if the API fails or returns no parseable body
   */
  public FrankfurterLatestResponse getConversion(
      String fromCurrency, String toCurrency, BigDecimal amount) {
    var url =
        new StringBuilder("/latest")
            .append("?from=")
            .append(encode(fromCurrency))
            .append("&to=")
            .append(encode(toCurrency))
            .append("&amount=")
            .append(encode(amount.toPlainString()));
    log.info(
        "Requesting Frankfurter conversion - from: {}, to: {}, amount: {}",
        fromCurrency,
        toCurrency,
        amount.toPlainString());

    return requireComplete(fetch(url.toString(), FrankfurterLatestResponse.class), url);
  }

  /**
   * Fetches the dated rate series for a window.
   *
   * @param baseCurrency ISO 4217 base currency code
   * @param startDate first date of the window
   * @param endDate last date of the window
   * @return parsed response with a non-null rate series
   * @throws UpstreamException if the API fails or returns no parseable body
   */
  public FrankfurterTimeSeriesResponse getTimeSeries(
      String baseCurrency, LocalDate startDate, LocalDate endDate) {
    var url =
        new StringBuilder("/")
            .append(startDate)
            .append("..")
            .append(endDate)
            .append("?from=")
            .append(encode(baseCurrency));
    log.info(
        "Requesting Frankfurter time series - from: {}, startDate: {}, endDate: {}",
        baseCurrency,
        startDate,
        endDate);

    var response = fetch(url.toString(), FrankfurterTimeSeriesResponse.class);
    if (response.rates() == null) {
      log.warn("Frankfurter time series response without rates: {}", url);
      throw new UpstreamException(INVALID_RESPONSE_MESSAGE);
    }

    return response;
  }

  private static FrankfurterLatestResponse requireComplete(
      FrankfurterLatestResponse response, CharSequence url) {
    if (response.rates() == null || response.base() == null || response.date() == null) {
      log.warn("Frankfurter response missing base, date or rates: {}", url);
      throw new UpstreamException(INVALID_RESPONSE_MESSAGE);
    }

    return response;
  }

  private <T> T fetch(String url, Class<T> responseType) {
    try {
      var response =
          webClient
              .get()
              .uri(url)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(responseType)
              .timeout(timeout)
              .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
              .retryWhen(rateLimitRetry(url))
              .block();

      if (response == null) {
        throw new UpstreamException(INVALID_RESPONSE_MESSAGE);
      }

      log.debug("Successfully fetched data from Frankfurter API: {}", url);
      return response;
    } catch (UpstreamException ue) {
      throw ue;
    } catch (CallNotPermittedException e) {
      log.warn("Frankfurter circuit breaker is open, rejecting call: {}", url);
      throw new UpstreamException("Frankfurter API unavailable: circuit breaker is open", e);
    } catch (Exception e) {
      if (isInterruption(e)) {
        Thread.currentThread().interrupt();
        throw new RequestCancelledException("Frankfurter request cancelled: " + url, e);
      }

      log.warn("Unexpected error fetching Frankfurter data {}: {}", url, e.getMessage(), e);
      throw new UpstreamException("Failed to fetch Frankfurter data: " + url, e);
    }
  }

  private RetryBackoffSpec rateLimitRetry(String url) {
    return Retry.backoff(retry.getMaxAttempts() - 1L, retry.getInitialBackoff())
        .jitter(0.5)
        .filter(FrankfurterClient::isRateLimited)
        .doBeforeRetry(
            signal ->
                log.warn(
                    "Frankfurter rate limit hit for {} - retry attempt {}",
                    url,
                    signal.totalRetries() + 1))
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
  }

  private static boolean isRateLimited(Throwable t) {
    return t instanceof UpstreamException ue
        && ue.getStatusCode() != null
        && ue.getStatusCode() == HttpStatus.TOO_MANY_REQUESTS.value();
  }

  private static boolean isInterruption(Exception e) {
    return Thread.currentThread().isInterrupted()
        || Exceptions.unwrap(e) instanceof InterruptedException;
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response, body));
  }

  private Throwable parseErrorAndCreateException(ClientResponse response, String body) {
    var errorMessage = body;

    // Frankfurter reports errors as {"message": "..."}
    if (body != null && !body.isBlank()) {
      try {
        var errorResponse = objectMapper.readValue(body, FrankfurterErrorResponse.class);
        if (errorResponse.message() != null) {
          errorMessage = errorResponse.message();
        }
      } catch (JsonProcessingException e) {
        log.debug("Could not parse Frankfurter error response as JSON: {}", e.getMessage());

        if (body.length() > MAX_ERROR_BODY_LENGTH) {
          errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
        }
      }
    }

    var statusCode = response.statusCode().value();
    log.warn("Frankfurter API error: HTTP {} - Message: {}", statusCode, errorMessage);

    return new UpstreamException(
        "Frankfurter API error message: " + errorMessage + " status: " + statusCode, statusCode);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
