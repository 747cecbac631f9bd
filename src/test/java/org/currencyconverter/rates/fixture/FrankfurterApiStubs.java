package org.currencyconverter.rates.fixture;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;

import java.time.LocalDate;

import com.github.tomakehurst.wiremock.stubbing.Scenario;

/**
 * WireMock stub templates for Frankfurter API responses.
 *
 * <p>Rates in the success bodies always include {@link TestConstants#EXCLUDED_CURRENCY_TRY}, so
 * tests can check it is removed before reaching callers.
 *
 * <p><b>Usage Example:</b>
 *
 * <pre>{@code
 * FrankfurterApiStubs.stubLatest(TestConstants.CURRENCY_EUR);
 * var response = frankfurterClient.getLatest("EUR");
 * }</pre>
 *
 * @see com.github.tomakehurst.wiremock.client.WireMock
 */
public final class FrankfurterApiStubs {

  private FrankfurterApiStubs() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  // ===========================================================================================
  // Success Scenarios
  // ===========================================================================================

  /**
   * Stubs {@code GET /latest?from=base} with USD, GBP and TRY rates.
   *
   * @param baseCurrency value expected in the {@code from} parameter
   */
  public static void stubLatest(String baseCurrency) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_FROM, equalTo(baseCurrency))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(latestBody(baseCurrency))));
  }

  /**
   * Stubs {@code GET /latest?from=..&to=..&amount=..} with a single converted value.
   *
   * @param from source currency
   * @param to target currency
   * @param amount amount as sent on the wire, in plain notation
   * @param converted converted amount returned by the stub
   */
  public static void stubConversion(String from, String to, String amount, String converted) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_FROM, equalTo(from))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_TO, equalTo(to))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_AMOUNT, equalTo(amount))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(
                        """
                        {
                          "amount": %s,
                          "base": "%s",
                          "date": "%s",
                          "rates": {"%s": %s}
                        }
                        """
                            .formatted(amount, from, TestConstants.RATE_DATE, to, converted))));
  }

  /**
   * Stubs {@code GET /2025-01-01..2025-01-05?from=base} with one entry per day, returned out of
   * date order.
   *
   * @param baseCurrency value expected in the {@code from} parameter
   */
  public static void stubTimeSeries(String baseCurrency) {
    stubFor(
        get(urlPathEqualTo(
                timeSeriesPath(TestConstants.WINDOW_START, TestConstants.WINDOW_END)))
            .withQueryParam(TestConstants.FRANKFURTER_PARAM_FROM, equalTo(baseCurrency))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(
                        """
                        {
                          "amount": 1.0,
                          "base": "%s",
                          "start_date": "2025-01-01",
                          "end_date": "2025-01-05",
                          "rates": {
                            "2025-01-03": {"USD": 1.03, "TRY": 36.5},
                            "2025-01-01": {"USD": 1.01, "TRY": 36.1},
                            "2025-01-05": {"USD": 1.05, "TRY": 36.9},
                            "2025-01-02": {"USD": 1.02, "TRY": 36.3},
                            "2025-01-04": {"USD": 1.04, "TRY": 36.7}
                          }
                        }
                        """
                            .formatted(baseCurrency))));
  }

  // ===========================================================================================
  // Error Scenarios
  // ===========================================================================================

  /**
   * Stubs {@code GET /latest} with an error status and Frankfurter's JSON error body.
   *
   * @param status HTTP status to return
   * @param message value of the {@code message} field
   */
  public static void stubLatestError(int status, String message) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .willReturn(
                aResponse()
                    .withStatus(status)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"message\": \"" + message + "\"}")));
  }

  /**
   * Stubs {@code GET /latest} with an error status and a plain-text body.
   *
   * @param status HTTP status to return
   * @param body raw response body
   */
  public static void stubLatestPlainTextError(int status, String body) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .willReturn(
                aResponse()
                    .withStatus(status)
                    .withHeader("Content-Type", "text/plain")
                    .withBody(body)));
  }

  /** Stubs {@code GET /latest} with a 200 whose body is not valid JSON. */
  public static void stubLatestMalformedJson() {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"amount\": 1.0, \"rates\": {")));
  }

  /**
   * Stubs {@code GET /latest} with a 200 and the given JSON body.
   *
   * @param body response body, typically missing required fields
   */
  public static void stubLatestBody(String body) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(body)));
  }

  /**
   * Stubs the five-day time series path with a 200 and the given JSON body.
   *
   * @param body response body, typically missing required fields
   */
  public static void stubTimeSeriesBody(String body) {
    stubFor(
        get(urlPathEqualTo(
                timeSeriesPath(TestConstants.WINDOW_START, TestConstants.WINDOW_END)))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(body)));
  }

  /**
   * Stubs {@code GET /latest} to answer slower than the client timeout.
   *
   * @param baseCurrency base currency of the delayed body
   * @param delayMillis fixed delay before the response
   */
  public static void stubLatestDelayed(String baseCurrency, int delayMillis) {
    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(latestBody(baseCurrency))
                    .withFixedDelay(delayMillis)));
  }

  /**
   * Stubs {@code GET /latest} to answer 429 a number of times before succeeding.
   *
   * @param baseCurrency base currency of the eventual success body
   * @param rateLimitedResponses how many 429 responses precede the success
   */
  public static void stubLatestRateLimitedThenSuccess(
      String baseCurrency, int rateLimitedResponses) {
    var scenario = "rate-limited-latest";
    var state = Scenario.STARTED;

    for (int i = 1; i <= rateLimitedResponses; i++) {
      var nextState = "attempt-" + (i + 1);
      stubFor(
          get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
              .inScenario(scenario)
              .whenScenarioStateIs(state)
              .willReturn(
                  aResponse()
                      .withStatus(429)
                      .withHeader("Content-Type", "application/json")
                      .withBody("{\"message\": \"too many requests\"}"))
              .willSetStateTo(nextState));
      state = nextState;
    }

    stubFor(
        get(urlPathEqualTo(TestConstants.FRANKFURTER_PATH_LATEST))
            .inScenario(scenario)
            .whenScenarioStateIs(state)
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody(latestBody(baseCurrency))));
  }

  // ===========================================================================================
  // Helpers
  // ===========================================================================================

  public static String timeSeriesPath(LocalDate start, LocalDate end) {
    return "/" + start + ".." + end;
  }

  private static String latestBody(String baseCurrency) {
    return """
        {
          "amount": 1.0,
          "base": "%s",
          "date": "%s",
          "rates": {"USD": %s, "GBP": %s, "TRY": %s}
        }
        """
        .formatted(
            baseCurrency,
            TestConstants.RATE_DATE,
            TestConstants.RATE_EUR_USD,
            TestConstants.RATE_EUR_GBP,
            TestConstants.RATE_EUR_TRY);
  }
}
