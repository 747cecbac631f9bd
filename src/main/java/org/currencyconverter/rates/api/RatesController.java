package org.currencyconverter.rates.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.currencyconverter.rates.api.response.ApiErrorResponse;
import org.currencyconverter.rates.api.response.ExchangeRateResponse;
import org.currencyconverter.rates.api.response.HistoricalRatesResponse;
import org.currencyconverter.rates.config.OpenApiConfig;
import org.currencyconverter.rates.service.query.ConvertCurrencyQuery;
import org.currencyconverter.rates.service.query.ConvertCurrencyQueryHandler;
import org.currencyconverter.rates.service.query.HistoricalRatesQuery;
import org.currencyconverter.rates.service.query.HistoricalRatesQueryHandler;
import org.currencyconverter.rates.service.query.LatestRatesQuery;
import org.currencyconverter.rates.service.query.LatestRatesQueryHandler;

/**
 * Exchange rate endpoints.
 *
 * <p>Handlers run on the MVC async executor; a request that outlives the async timeout has its
 * worker interrupted and nothing is cached for it.
 */
@Tag(name = "Exchange Rates", description = "Latest, converted and historical exchange rates")
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
@RestController
@RequestMapping(path = "/api/v1/rates")
public class RatesController {

  private static final Logger log = LoggerFactory.getLogger(RatesController.class);

  private final LatestRatesQueryHandler latestRatesQueryHandler;
  private final ConvertCurrencyQueryHandler convertCurrencyQueryHandler;
  private final HistoricalRatesQueryHandler historicalRatesQueryHandler;

  public RatesController(
      LatestRatesQueryHandler latestRatesQueryHandler,
      ConvertCurrencyQueryHandler convertCurrencyQueryHandler,
      HistoricalRatesQueryHandler historicalRatesQueryHandler) {
    this.latestRatesQueryHandler = latestRatesQueryHandler;
    this.convertCurrencyQueryHandler = convertCurrencyQueryHandler;
    this.historicalRatesQueryHandler = historicalRatesQueryHandler;
  }

  @PreAuthorize("hasAnyRole('User', 'Admin')")
  @Operation(
      summary = "Get latest rates",
      description = "Latest published rates for the base currency, excluding TRY, PLN, THB, MXN")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid base currency",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "Rate provider failed")
      })
  @GetMapping(path = "/latest", produces = "application/json")
  public Callable<ExchangeRateResponse> getLatestRates(
      @Parameter(description = "Base currency ISO code", example = "EUR")
          @RequestParam(required = false)
          String baseCurrency,
      Authentication authentication) {
    log.info(
        "Received getLatestRates request - user: {}, baseCurrency: {}",
        authentication.getName(),
        baseCurrency);

    var query = new LatestRatesQuery(baseCurrency);
    return () -> ExchangeRateResponse.from(latestRatesQueryHandler.handle(query));
  }

  @PreAuthorize("hasAnyRole('User', 'Admin')")
  @Operation(
      summary = "Convert an amount",
      description = "Converts an amount between two currencies at the latest published rate")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Excluded Currency",
                          summary = "One of the currencies is not supported",
                          value =
                              """
                      {
                        "type": "VALIDATION",
                        "message": "toCurrency: Currencies TRY, PLN, THB, MXN are not supported.",
                        "fieldErrors": [
                          {
                            "field": "toCurrency",
                            "message": "Currencies TRY, PLN, THB, MXN are not supported."
                          }
                        ]
                      }
                      """)
                    })),
        @ApiResponse(responseCode = "502", description = "Rate provider failed")
      })
  @GetMapping(path = "/convert", produces = "application/json")
  public Callable<ExchangeRateResponse> convertCurrency(
      @Parameter(description = "Currency to convert from", example = "EUR")
          @RequestParam(required = false)
          String fromCurrency,
      @Parameter(description = "Currency to convert to", example = "USD")
          @RequestParam(required = false)
          String toCurrency,
      @Parameter(description = "Amount to convert, greater than zero", example = "100")
          @RequestParam(required = false)
          BigDecimal amount,
      Authentication authentication) {
    log.info(
        "Received convertCurrency request - user: {}, from: {}, to: {}, amount: {}",
        authentication.getName(),
        fromCurrency,
        toCurrency,
        amount);

    var query = new ConvertCurrencyQuery(fromCurrency, toCurrency, amount);
    return () -> ExchangeRateResponse.from(convertCurrencyQueryHandler.handle(query));
  }

  @PreAuthorize("hasRole('Admin')")
  @Operation(
      summary = "Get historical rates",
      description =
          "Paged daily rates between two dates, ascending by date. Requires the Admin role")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = HistoricalRatesResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(responseCode = "403", description = "Caller is not an Admin"),
        @ApiResponse(responseCode = "502", description = "Rate provider failed")
      })
  @GetMapping(path = "/historical", produces = "application/json")
  public Callable<HistoricalRatesResponse> getHistoricalRates(
      @Parameter(description = "Base currency ISO code", example = "EUR")
          @RequestParam(required = false)
          String baseCurrency,
      @Parameter(description = "First date in ISO format", example = "2025-01-01")
          @RequestParam(required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @Parameter(description = "Last date in ISO format", example = "2025-01-31")
          @RequestParam(required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate,
      @Parameter(description = "1-based page number", example = "1")
          @RequestParam(defaultValue = "" + HistoricalRatesQuery.DEFAULT_PAGE)
          int page,
      @Parameter(description = "Dates per page, 1 to 100", example = "10")
          @RequestParam(defaultValue = "" + HistoricalRatesQuery.DEFAULT_PAGE_SIZE)
          int pageSize,
      Authentication authentication) {
    log.info(
        "Received getHistoricalRates request - user: {}, baseCurrency: {}, startDate: {},"
            + " endDate: {}, page: {}, pageSize: {}",
        authentication.getName(),
        baseCurrency,
        startDate,
        endDate,
        page,
        pageSize);

    var query = new HistoricalRatesQuery(baseCurrency, startDate, endDate, page, pageSize);
    return () -> HistoricalRatesResponse.from(historicalRatesQueryHandler.handle(query));
  }
}
