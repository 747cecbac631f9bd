package org.currencyconverter.rates.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "currency-converter")
@Validated
public class CurrencyConverterProperties {

  /** Name of the exchange rate provider used by all rate queries. */
  @NotBlank private String activeProvider = "frankfurter";

  @Valid private Frankfurter frankfurter = new Frankfurter();
  @Valid private Cache cache = new Cache();
  @Valid private Security security = new Security();

  public String getActiveProvider() {
    return activeProvider;
  }

  public void setActiveProvider(String activeProvider) {
    this.activeProvider = activeProvider;
  }

  public Frankfurter getFrankfurter() {
    return frankfurter;
  }

  public void setFrankfurter(Frankfurter frankfurter) {
    this.frankfurter = frankfurter;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Security getSecurity() {
    return security;
  }

  public void setSecurity(Security security) {
    this.security = security;
  }

  public static class Frankfurter {
    /** Frankfurter API base URL. */
    @NotBlank private String baseUrl = "https://api.frankfurter.dev/v1/";

    /** Timeout in seconds for a single Frankfurter request. */
    @Min(1)
    @Max(120)
    private int timeoutSeconds = 10;

    /** Timeout for establishing the TCP connection. */
    @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

    @Valid private Retry retry = new Retry();

    @Valid private CircuitBreaker circuitBreaker = new CircuitBreaker();

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }

    public CircuitBreaker getCircuitBreaker() {
      return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
    }
  }

  public static class Retry {
    /**
     * Maximum number of attempts for rate-limited (HTTP 429) requests, including the initial
     * attempt.
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Backoff before the first retry; doubled for every following retry. */
    @NotNull private Duration initialBackoff = Duration.ofSeconds(1);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }
  }

  public static class CircuitBreaker {
    /** Percentage of failed calls in the sliding window that opens the breaker. */
    @Min(1)
    @Max(100)
    private int failureRateThreshold = 50;

    /** Number of recent calls the failure rate is computed over. */
    @Min(1)
    private int slidingWindowSize = 10;

    /** Calls required before the failure rate is evaluated at all. */
    @Min(1)
    private int minimumNumberOfCalls = 5;

    /** How long the breaker rejects calls before letting trial calls through. */
    @NotNull private Duration waitDurationInOpenState = Duration.ofMinutes(1);

    /** Trial calls allowed while half-open. */
    @Min(1)
    private int permittedCallsInHalfOpenState = 3;

    public int getFailureRateThreshold() {
      return failureRateThreshold;
    }

    public void setFailureRateThreshold(int failureRateThreshold) {
      this.failureRateThreshold = failureRateThreshold;
    }

    public int getSlidingWindowSize() {
      return slidingWindowSize;
    }

    public void setSlidingWindowSize(int slidingWindowSize) {
      this.slidingWindowSize = slidingWindowSize;
    }

    public int getMinimumNumberOfCalls() {
      return minimumNumberOfCalls;
    }

    public void setMinimumNumberOfCalls(int minimumNumberOfCalls) {
      this.minimumNumberOfCalls = minimumNumberOfCalls;
    }

    public Duration getWaitDurationInOpenState() {
      return waitDurationInOpenState;
    }

    public void setWaitDurationInOpenState(Duration waitDurationInOpenState) {
      this.waitDurationInOpenState = waitDurationInOpenState;
    }

    public int getPermittedCallsInHalfOpenState() {
      return permittedCallsInHalfOpenState;
    }

    public void setPermittedCallsInHalfOpenState(int permittedCallsInHalfOpenState) {
      this.permittedCallsInHalfOpenState = permittedCallsInHalfOpenState;
    }
  }

  public static class Cache {
    /** Key prefix isolating this service's entries in a shared Redis instance. */
    @NotBlank private String keyPrefix = "currency-converter:";

    /** Expiry of latest-rate entries. */
    @NotNull private Duration latestRatesTtl = Duration.ofHours(1);

    /** Expiry of conversion entries. */
    @NotNull private Duration conversionTtl = Duration.ofHours(1);

    /** Expiry of historical-rate entries. */
    @NotNull private Duration historicalRatesTtl = Duration.ofHours(24);

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }

    public Duration getLatestRatesTtl() {
      return latestRatesTtl;
    }

    public void setLatestRatesTtl(Duration latestRatesTtl) {
      this.latestRatesTtl = latestRatesTtl;
    }

    public Duration getConversionTtl() {
      return conversionTtl;
    }

    public void setConversionTtl(Duration conversionTtl) {
      this.conversionTtl = conversionTtl;
    }

    public Duration getHistoricalRatesTtl() {
      return historicalRatesTtl;
    }

    public void setHistoricalRatesTtl(Duration historicalRatesTtl) {
      this.historicalRatesTtl = historicalRatesTtl;
    }
  }

  public static class Security {
    /** Issuer written to and required from every token. */
    @NotBlank private String issuer = "currency-converter";

    /** Audience written to and required from every token. */
    @NotBlank private String audience = "currency-converter-clients";

    /** HMAC-SHA256 signing secret - should be set via environment variable. */
    @NotBlank(message = "JWT signing secret must be configured")
    @Size(min = 32, message = "JWT signing secret must be at least 32 characters")
    private String jwtSecret;

    /** Lifetime of issued tokens. */
    @NotNull private Duration tokenTtl = Duration.ofHours(1);

    /** Username accepted by the token endpoint. */
    @NotBlank private String demoUsername = "test";

    /** Password accepted by the token endpoint. */
    @NotBlank private String demoPassword = "password";

    public String getIssuer() {
      return issuer;
    }

    public void setIssuer(String issuer) {
      this.issuer = issuer;
    }

    public String getAudience() {
      return audience;
    }

    public void setAudience(String audience) {
      this.audience = audience;
    }

    public String getJwtSecret() {
      return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
      this.jwtSecret = jwtSecret;
    }

    public Duration getTokenTtl() {
      return tokenTtl;
    }

    public void setTokenTtl(Duration tokenTtl) {
      this.tokenTtl = tokenTtl;
    }

    public String getDemoUsername() {
      return demoUsername;
    }

    public void setDemoUsername(String demoUsername) {
      this.demoUsername = demoUsername;
    }

    public String getDemoPassword() {
      return demoPassword;
    }

    public void setDemoPassword(String demoPassword) {
      this.demoPassword = demoPassword;
    }
  }
}
