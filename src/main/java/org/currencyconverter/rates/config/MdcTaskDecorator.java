package org.currencyconverter.rates.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;
import org.springframework.stereotype.Component;

/**
 * Copies the submitting thread's MDC onto async worker threads.
 *
 * <p>Spring Boot applies this decorator to the application task executor, which also runs the
 * {@code Callable} results of the rate endpoints, so their log lines keep the request's
 * correlation id.
 */
@Component
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    var contextMap = MDC.getCopyOfContextMap();
    return () -> {
      var previous = MDC.getCopyOfContextMap();
      if (contextMap != null) {
        MDC.setContextMap(contextMap);
      } else {
        MDC.clear();
      }
      try {
        runnable.run();
      } finally {
        if (previous != null) {
          MDC.setContextMap(previous);
        } else {
          MDC.clear();
        }
      }
    };
  }
}
