package org.currencyconverter.rates.config;

import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;

import org.currencyconverter.rates.api.response.ApiErrorResponse;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Currency Converter Service",
            version = "1.0",
            description =
                "Latest, converted and historical exchange rates backed by the Frankfurter API",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {@Server(url = "http://localhost:8080", description = "Local environment")})
@SecurityScheme(
    name = OpenApiConfig.BEARER_SCHEME,
    type = SecuritySchemeType.HTTP,
    scheme = "bearer",
    bearerFormat = "JWT")
public class OpenApiConfig {

  public static final String BEARER_SCHEME = "bearerAuth";

  /** Documents the error responses every operation can produce. */
  @Bean
  public OpenApiCustomizer globalResponseCustomizer() {
    return openApi -> {
      if (openApi.getPaths() != null) {
        openApi
            .getPaths()
            .values()
            .forEach(
                pathItem ->
                    pathItem
                        .readOperations()
                        .forEach(OpenApiConfig::addStandardErrorResponses));
      }
    };
  }

  private static void addStandardErrorResponses(Operation operation) {
    var responses = operation.getResponses();
    responses.putIfAbsent(
        "500", buildExampleApiErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR"));
    responses.putIfAbsent(
        "503",
        buildExampleApiErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "CACHE_INFRASTRUCTURE"));
  }

  private static ApiResponse buildExampleApiErrorResponse(HttpStatus httpStatus, String type) {
    var exampleResponse = ApiErrorResponse.of(type, httpStatus.getReasonPhrase());

    return new ApiResponse()
        .description(httpStatus.getReasonPhrase())
        .content(
            new Content()
                .addMediaType(
                    "application/json",
                    new MediaType()
                        .schema(new Schema<>().$ref("#/components/schemas/ApiErrorResponse"))
                        .example(exampleResponse)));
  }
}
