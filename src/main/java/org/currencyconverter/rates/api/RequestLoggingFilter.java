package org.currencyconverter.rates.api;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs one line per request with method, path, caller, client address, status and duration.
 *
 * <p>Also assigns the request a correlation id, taken from the {@value #CORRELATION_ID_HEADER}
 * header when present, which is echoed on the response and exposed to log lines through the
 * {@value #CORRELATION_ID_MDC_KEY} MDC key.
 *
 * <p>Registered after the security filter chain, so requests rejected by authentication are not
 * logged here.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  public static final String CORRELATION_ID_MDC_KEY = "correlationId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var correlationId = resolveCorrelationId(request);
    var clientId = currentClientId();
    var startNanos = System.nanoTime();

    MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      if (isAsyncStarted(request)) {
        // status is only known once the async result has been written
        request
            .getAsyncContext()
            .addListener(
                new CompletionLogger(request, response, correlationId, clientId, startNanos));
      } else {
        logRequest(request, response.getStatus(), clientId, startNanos);
      }
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }

  private static String resolveCorrelationId(HttpServletRequest request) {
    var header = request.getHeader(CORRELATION_ID_HEADER);
    return StringUtils.hasText(header) ? header.trim() : UUID.randomUUID().toString();
  }

  private static String currentClientId() {
    var authentication = SecurityContextHolder.getContext().getAuthentication();
    return authentication != null && authentication.isAuthenticated()
        ? authentication.getName()
        : "anonymous";
  }

  private static void logRequest(
      HttpServletRequest request, int status, String clientId, long startNanos) {
    var durationMillis = (System.nanoTime() - startNanos) / 1_000_000;
    log.info(
        "HTTP {} {} - client: {}, ip: {}, status: {}, duration: {} ms",
        request.getMethod(),
        request.getRequestURI(),
        clientId,
        request.getRemoteAddr(),
        status,
        durationMillis);
  }

  private static final class CompletionLogger implements AsyncListener {

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final String correlationId;
    private final String clientId;
    private final long startNanos;

    private CompletionLogger(
        HttpServletRequest request,
        HttpServletResponse response,
        String correlationId,
        String clientId,
        long startNanos) {
      this.request = request;
      this.response = response;
      this.correlationId = correlationId;
      this.clientId = clientId;
      this.startNanos = startNanos;
    }

    @Override
    public void onComplete(AsyncEvent event) {
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      try {
        logRequest(request, response.getStatus(), clientId, startNanos);
      } finally {
        MDC.remove(CORRELATION_ID_MDC_KEY);
      }
    }

    @Override
    public void onTimeout(AsyncEvent event) {}

    @Override
    public void onError(AsyncEvent event) {}

    @Override
    public void onStartAsync(AsyncEvent event) {}
  }
}
