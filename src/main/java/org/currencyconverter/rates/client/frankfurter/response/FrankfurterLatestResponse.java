package org.currencyconverter.rates.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Body of {@code GET /latest}, used for both plain rate lookups and conversions. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterLatestResponse(
    BigDecimal amount, String base, LocalDate date, Map<String, BigDecimal> rates) {}
