package org.currencyconverter.rates.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import jakarta.validation.Validation;
import jakarta.validation.Validator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.domain.RateSnapshot;
import org.currencyconverter.rates.exception.RequestCancelledException;
import org.currencyconverter.rates.exception.UnsupportedProviderException;
import org.currencyconverter.rates.exception.UpstreamException;
import org.currencyconverter.rates.exception.ValidationException;
import org.currencyconverter.rates.fixture.InMemoryCacheService;
import org.currencyconverter.rates.service.cache.CacheService;
import org.currencyconverter.rates.service.provider.ExchangeRateProvider;
import org.currencyconverter.rates.service.provider.ExchangeRateProviderFactory;

@ExtendWith(MockitoExtension.class)
class LatestRatesQueryHandlerTest {

  private static final Validator VALIDATOR =
      Validation.buildDefaultValidatorFactory().getValidator();

  private static final String CACHE_KEY = "rates:latest:EUR";

  private static final RateSnapshot SNAPSHOT =
      new RateSnapshot(
          BigDecimal.ONE,
          "EUR",
          LocalDate.of(2025, 1, 3),
          Map.of("USD", new BigDecimal("1.0321"), "GBP", new BigDecimal("0.8292")));

  @Mock private ExchangeRateProviderFactory providerFactory;

  @Mock private CacheService cacheService;

  @Mock private ExchangeRateProvider provider;

  private LatestRatesQueryHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new LatestRatesQueryHandler(
            providerFactory, cacheService, VALIDATOR, new CurrencyConverterProperties());
  }

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("Should return cached snapshot without calling the provider")
  void shouldReturnCachedSnapshotOnHit() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.of(SNAPSHOT));

    // Act
    var result = handler.handle(new LatestRatesQuery("EUR"));

    // Assert
    assertThat(result).isEqualTo(SNAPSHOT);
    verifyNoInteractions(providerFactory);
    verify(cacheService, never()).set(anyString(), any(), any());
  }

  @Test
  @DisplayName("Should fetch once and cache for one hour on a miss")
  void shouldFetchAndCacheOnMiss() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.empty());
    when(providerFactory.createProvider("frankfurter")).thenReturn(provider);
    when(provider.getLatestRates("EUR")).thenReturn(SNAPSHOT);

    // Act
    var result = handler.handle(new LatestRatesQuery("EUR"));

    // Assert
    assertThat(result).isEqualTo(SNAPSHOT);
    verify(provider, times(1)).getLatestRates("EUR");
    verify(cacheService).set(CACHE_KEY, SNAPSHOT, Duration.ofHours(1));
  }

  @Test
  @DisplayName("Should reject invalid base currency before touching cache or provider")
  void shouldRejectInvalidBaseCurrency() {
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery("eur")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("baseCurrency: Base currency must be a valid 3-letter ISO code.");

    verifyNoInteractions(cacheService, providerFactory);
  }

  @Test
  @DisplayName("Should reject missing base currency")
  void shouldRejectMissingBaseCurrency() {
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery(null)))
        .isInstanceOf(ValidationException.class)
        .satisfies(
            e ->
                assertThat(((ValidationException) e).getFieldErrors())
                    .containsExactly(
                        new ValidationException.FieldError(
                            "baseCurrency", "Base currency is required.")));

    verifyNoInteractions(cacheService, providerFactory);
  }

  @Test
  @DisplayName("Should propagate provider failure and cache nothing")
  void shouldNotCacheProviderFailure() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.empty());
    when(providerFactory.createProvider("frankfurter")).thenReturn(provider);
    when(provider.getLatestRates("EUR"))
        .thenThrow(new UpstreamException("Frankfurter API error message: boom status: 500", 500));

    // Act / Assert
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery("EUR")))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("boom");
    verify(cacheService, never()).set(anyString(), any(), any());
  }

  @Test
  @DisplayName("Should propagate unsupported provider")
  void shouldPropagateUnsupportedProvider() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.empty());
    when(providerFactory.createProvider("frankfurter"))
        .thenThrow(new UnsupportedProviderException("frankfurter"));

    // Act / Assert
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery("EUR")))
        .isInstanceOf(UnsupportedProviderException.class);
    verify(cacheService, never()).set(anyString(), any(), any());
  }

  @Test
  @DisplayName("Should stop before the provider call when the request is cancelled")
  void shouldStopBeforeProviderCallWhenCancelled() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.empty());
    when(providerFactory.createProvider("frankfurter")).thenReturn(provider);
    Thread.currentThread().interrupt();

    // Act / Assert
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery("EUR")))
        .isInstanceOf(RequestCancelledException.class);
    verifyNoInteractions(provider);
    verify(cacheService, never()).set(anyString(), any(), any());
  }

  @Test
  @DisplayName("Should not cache a result that arrives after cancellation")
  void shouldNotCacheWhenCancelledDuringProviderCall() {
    // Arrange
    when(cacheService.get(CACHE_KEY, RateSnapshot.class)).thenReturn(Optional.empty());
    when(providerFactory.createProvider("frankfurter")).thenReturn(provider);
    when(provider.getLatestRates("EUR"))
        .thenAnswer(
            invocation -> {
              Thread.currentThread().interrupt();
              return SNAPSHOT;
            });

    // Act / Assert
    assertThatThrownBy(() -> handler.handle(new LatestRatesQuery("EUR")))
        .isInstanceOf(RequestCancelledException.class);
    verify(cacheService, never()).set(anyString(), any(), any());
  }

  @Test
  @DisplayName("Should return deep-equal results from provider and from cache")
  void shouldReturnEqualResultsFromProviderAndCache() {
    // Arrange
    var objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    var cache = new InMemoryCacheService(objectMapper);
    var cachingHandler =
        new LatestRatesQueryHandler(
            providerFactory, cache, VALIDATOR, new CurrencyConverterProperties());
    when(providerFactory.createProvider("frankfurter")).thenReturn(provider);
    when(provider.getLatestRates("EUR")).thenReturn(SNAPSHOT);

    // Act
    var first = cachingHandler.handle(new LatestRatesQuery("EUR"));
    var second = cachingHandler.handle(new LatestRatesQuery("EUR"));

    // Assert
    assertThat(second).isEqualTo(first);
    assertThat(cache.ttlOf(CACHE_KEY)).contains(Duration.ofHours(1));
    verify(provider, times(1)).getLatestRates("EUR");
  }
}
