package org.currencyconverter.rates.client.frankfurter;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import org.currencyconverter.rates.base.AbstractWireMockTest;
import org.currencyconverter.rates.exception.UpstreamException;
import org.currencyconverter.rates.fixture.FrankfurterApiStubs;
import org.currencyconverter.rates.fixture.TestConstants;

/**
 * Integration tests for FrankfurterClient using WireMock to simulate Frankfurter API responses.
 *
 * <p>The test profile sets a 2 second timeout, 3 attempts and a 10 ms initial backoff. The circuit
 * breaker keeps its defaults: 50% failures over at least 5 calls opens it.
 *
 * @see FrankfurterClient
 * @see FrankfurterApiStubs
 */
@DisplayName("FrankfurterClient Integration Tests")
class FrankfurterClientIntegrationTest extends AbstractWireMockTest {

  @Autowired private FrankfurterClient frankfurterClient;

  // ===========================================================================================
  // Success Scenarios
  // ===========================================================================================

  @Test
  @DisplayName("Should fetch latest rates with exact decimal values")
  void shouldFetchLatestRates() {
    // Given
    FrankfurterApiStubs.stubLatest(TestConstants.CURRENCY_EUR);

    // When
    var response = frankfurterClient.getLatest(TestConstants.CURRENCY_EUR);

    // Then
    assertThat(response.base()).isEqualTo(TestConstants.CURRENCY_EUR);
    assertThat(response.date()).isEqualTo(TestConstants.RATE_DATE);
    assertThat(response.amount()).isEqualByComparingTo(BigDecimal.ONE);
    assertThat(response.rates().get(TestConstants.CURRENCY_USD))
        .isEqualTo(TestConstants.RATE_EUR_USD);
    // exclusion is applied by the provider, not the client
    assertThat(response.rates()).containsKey(TestConstants.EXCLUDED_CURRENCY_TRY);
  }

  @Test
  @DisplayName("Should send amount in plain notation for conversions")
  void shouldSendPlainAmountForConversion() {
    // Given
    FrankfurterApiStubs.stubConversion("EUR", "USD", "100", "103.21");

    // When
    var response =
        frankfurterClient.getConversion("EUR", "USD", new BigDecimal("1E+2"));

    // Then
    assertThat(response.rates()).containsEntry("USD", new BigDecimal("103.21"));
    wireMockServer.verify(
        getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_AMOUNT, equalTo("100")));
  }

  @Test
  @DisplayName("Should fetch time series keyed by date")
  void shouldFetchTimeSeries() {
    // Given
    FrankfurterApiStubs.stubTimeSeries(TestConstants.CURRENCY_EUR);

    // When
    var response =
        frankfurterClient.getTimeSeries(
            TestConstants.CURRENCY_EUR, TestConstants.WINDOW_START, TestConstants.WINDOW_END);

    // Then
    assertThat(response.startDate()).isEqualTo(TestConstants.WINDOW_START);
    assertThat(response.endDate()).isEqualTo(TestConstants.WINDOW_END);
    assertThat(response.rates()).hasSize(5);
    assertThat(response.rates().get(TestConstants.WINDOW_START))
        .containsEntry("USD", new BigDecimal("1.01"));
  }

  // ===========================================================================================
  // Error Scenarios
  // ===========================================================================================

  @Test
  @DisplayName("Should surface upstream 404 with parsed message and status")
  void shouldThrowOnNotFound() {
    // Given
    FrankfurterApiStubs.stubLatestError(404, "not found");

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Frankfurter API error message: not found status: 404")
        .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(404));
  }

  @Test
  @DisplayName("Should not retry server errors")
  void shouldNotRetryServerError() {
    // Given
    FrankfurterApiStubs.stubLatestError(500, "internal error");

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("status: 500");
    wireMockServer.verify(
        exactly(1), getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST)));
  }

  @Test
  @DisplayName("Should truncate long non-JSON error bodies")
  void shouldTruncateNonJsonErrorBody() {
    // Given
    FrankfurterApiStubs.stubLatestPlainTextError(503, "x".repeat(600));

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("x".repeat(500) + "... (truncated)")
        .hasMessageNotContaining("x".repeat(501));
  }

  @Test
  @DisplayName("Should fail on malformed JSON body")
  void shouldFailOnMalformedJson() {
    // Given
    FrankfurterApiStubs.stubLatestMalformedJson();

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("Failed to fetch Frankfurter data");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{}",
        "{\"amount\": 1.0, \"base\": \"EUR\", \"date\": \"2025-01-03\"}",
        "{\"amount\": 1.0, \"date\": \"2025-01-03\", \"rates\": {\"USD\": 1.03}}",
        "{\"amount\": 1.0, \"base\": \"EUR\", \"rates\": {\"USD\": 1.03}}"
      })
  @DisplayName("Should reject latest responses missing base, date or rates")
  void shouldRejectIncompleteLatestResponse(String body) {
    // Given
    FrankfurterApiStubs.stubLatestBody(body);

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Invalid response from Frankfurter API");
  }

  @Test
  @DisplayName("Should reject conversion response without rates")
  void shouldRejectConversionWithoutRates() {
    // Given
    FrankfurterApiStubs.stubLatestBody("{}");

    // When / Then
    assertThatThrownBy(
            () -> frankfurterClient.getConversion("EUR", "USD", new BigDecimal("100")))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Invalid response from Frankfurter API");
  }

  @Test
  @DisplayName("Should reject time series response without rates")
  void shouldRejectTimeSeriesWithoutRates() {
    // Given
    FrankfurterApiStubs.stubTimeSeriesBody("{\"amount\": 1.0, \"base\": \"EUR\"}");

    // When / Then
    assertThatThrownBy(
            () ->
                frankfurterClient.getTimeSeries(
                    TestConstants.CURRENCY_EUR,
                    TestConstants.WINDOW_START,
                    TestConstants.WINDOW_END))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Invalid response from Frankfurter API");
  }

  @Test
  @DisplayName("Should time out slow responses")
  void shouldTimeOutSlowResponse() {
    // Given
    FrankfurterApiStubs.stubLatestDelayed(TestConstants.CURRENCY_EUR, 3_000);

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class);
  }

  // ===========================================================================================
  // Rate Limit Retry
  // ===========================================================================================

  @Test
  @DisplayName("Should retry 429 responses and return the eventual success")
  void shouldRetryRateLimitedRequests() {
    // Given
    FrankfurterApiStubs.stubLatestRateLimitedThenSuccess(TestConstants.CURRENCY_EUR, 2);

    // When
    var response = frankfurterClient.getLatest(TestConstants.CURRENCY_EUR);

    // Then
    assertThat(response.base()).isEqualTo(TestConstants.CURRENCY_EUR);
    wireMockServer.verify(
        exactly(3), getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST)));
  }

  @Test
  @DisplayName("Should give up after the configured number of attempts")
  void shouldStopRetryingAfterMaxAttempts() {
    // Given
    FrankfurterApiStubs.stubLatestRateLimitedThenSuccess(TestConstants.CURRENCY_EUR, 3);

    // When / Then
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("status: 429");
    wireMockServer.verify(
        exactly(3), getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST)));
  }

  // ===========================================================================================
  // Circuit Breaker
  // ===========================================================================================

  @Test
  @DisplayName("Should open the circuit after repeated server errors and stop calling the API")
  void shouldOpenCircuitAfterRepeatedServerErrors() {
    // Given
    FrankfurterApiStubs.stubLatestError(500, "internal error");
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
          .isInstanceOf(UpstreamException.class)
          .hasMessageContaining("status: 500");
    }

    // When / Then
    assertThat(frankfurterCircuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("Frankfurter API unavailable: circuit breaker is open")
        .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isNull());
    wireMockServer.verify(
        exactly(5), getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST)));
  }

  @Test
  @DisplayName("Should keep the circuit closed for client errors")
  void shouldKeepCircuitClosedOnClientErrors() {
    // Given
    FrankfurterApiStubs.stubLatestError(404, "not found");

    // When
    for (int i = 0; i < 6; i++) {
      assertThatThrownBy(() -> frankfurterClient.getLatest(TestConstants.CURRENCY_EUR))
          .isInstanceOf(UpstreamException.class)
          .hasMessageContaining("status: 404");
    }

    // Then
    assertThat(frankfurterCircuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    wireMockServer.verify(
        exactly(6), getRequestedFor(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST)));
  }
}
