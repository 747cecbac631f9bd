package org.currencyconverter.rates.client.frankfurter.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterErrorResponse(String message) {}
