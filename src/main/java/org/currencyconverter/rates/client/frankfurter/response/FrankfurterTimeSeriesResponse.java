package org.currencyconverter.rates.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /{start}..{end}}.
 *
 * <p>Frankfurter may report a {@code start_date} earlier than the one requested when the requested
 * start falls on a non-publishing day, so {@code rates} can contain dates outside the window.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterTimeSeriesResponse(
    BigDecimal amount,
    String base,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    Map<LocalDate, Map<String, BigDecimal>> rates) {}
