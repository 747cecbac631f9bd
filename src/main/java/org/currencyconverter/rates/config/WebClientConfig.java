package org.currencyconverter.rates.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient wiring for the Frankfurter client.
 *
 * <p>Connect and response timeouts come from {@code currency-converter.frankfurter}, so the
 * transport never gives up before the per-request timeout applied by the client.
 */
@Configuration
public class WebClientConfig {

  /** A full year of daily rates for ~30 currencies stays well below this. */
  static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

  @Bean
  public HttpClient frankfurterHttpClient(CurrencyConverterProperties properties) {
    var frankfurterConfig = properties.getFrankfurter();

    return HttpClient.create()
        .option(
            ChannelOption.CONNECT_TIMEOUT_MILLIS,
            Math.toIntExact(frankfurterConfig.getConnectTimeout().toMillis()))
        .responseTimeout(Duration.ofSeconds(frankfurterConfig.getTimeoutSeconds()));
  }

  @Bean
  public WebClient.Builder webClientBuilder(HttpClient frankfurterHttpClient) {
    var strategies =
        ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(frankfurterHttpClient))
        .exchangeStrategies(strategies);
  }
}
