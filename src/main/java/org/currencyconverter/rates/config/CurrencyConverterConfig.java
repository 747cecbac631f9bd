package org.currencyconverter.rates.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Currency Converter Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml. JavaTimeModule is automatically registered when jackson-datatype-jsr310 is on
 * the classpath.
 */
@Configuration
@EnableConfigurationProperties(CurrencyConverterProperties.class)
public class CurrencyConverterConfig {

  /**
   * Clock used to reject historical queries that reach into the future.
   *
   * @return system clock in the default time zone
   */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
