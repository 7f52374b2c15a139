package com.codeheadsystems.portal.server.filter;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import jakarta.annotation.Priority;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs method, path, status and duration of each request and feeds a per-method timer.
 */
@Provider
@PreMatching
@Priority(2)
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final String START_PROPERTY = RequestLoggingFilter.class.getName() + ".start";

  private final MetricRegistry metricRegistry;

  /**
   * Instantiates a new Request logging filter.
   *
   * @param metricRegistry the metric registry
   */
  public RequestLoggingFilter(final MetricRegistry metricRegistry) {
    this.metricRegistry = metricRegistry;
  }

  @Override
  public void filter(final ContainerRequestContext requestContext) {
    requestContext.setProperty(START_PROPERTY, System.nanoTime());
  }

  @Override
  public void filter(final ContainerRequestContext requestContext,
                     final ContainerResponseContext responseContext) {
    Object start = requestContext.getProperty(START_PROPERTY);
    if (!(start instanceof Long startNanos)) {
      return;
    }
    long elapsed = System.nanoTime() - startNanos;
    String method = requestContext.getMethod();
    int status = responseContext.getStatus();
    Timer timer = metricRegistry.timer(MetricRegistry.name("portal", "http", method.toLowerCase(Locale.ROOT)));
    timer.update(elapsed, TimeUnit.NANOSECONDS);
    metricRegistry.meter(MetricRegistry.name("portal", "http", "responses", (status / 100) + "xx")).mark();
    log.info("{} /{} -> {} ({} ms)", method, requestContext.getUriInfo().getPath(), status,
        TimeUnit.NANOSECONDS.toMillis(elapsed));
  }
}
