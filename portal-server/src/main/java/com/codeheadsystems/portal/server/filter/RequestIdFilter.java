package com.codeheadsystems.portal.server.filter;

import jakarta.annotation.Priority;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.slf4j.MDC;

/**
 * Assigns every request an id, taken from a well-formed {@code X-Request-ID} header or generated,
 * places it in the SLF4J {@link MDC} under {@code requestId} and echoes it on the response.
 * <p>
 * Jersey runs the filters, the resource method and the exception mappers of a synchronous request
 * on one thread, so code below the filter reads the id through {@link #currentRequestId()}.
 */
@Provider
@PreMatching
@Priority(1)
public class RequestIdFilter implements ContainerRequestFilter, ContainerResponseFilter {

  /** Header carrying the request id. */
  public static final String HEADER = "X-Request-ID";
  /** MDC key and request property name. */
  public static final String MDC_KEY = "requestId";

  private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
  private static final SecureRandom RANDOM = new SecureRandom();

  /**
   * The id of the request being handled on this thread.
   *
   * @return the id, or {@code "-"} outside a request
   */
  public static String currentRequestId() {
    String id = MDC.get(MDC_KEY);
    return id == null ? "-" : id;
  }

  /**
   * Returns the header value when it is a safe id, otherwise a fresh random one.
   *
   * @param candidate the incoming header value, may be null
   * @return the id to use
   */
  static String acceptOrGenerate(final String candidate) {
    if (candidate != null && VALID_ID.matcher(candidate).matches()) {
      return candidate;
    }
    byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }

  @Override
  public void filter(final ContainerRequestContext requestContext) {
    String id = acceptOrGenerate(requestContext.getHeaderString(HEADER));
    requestContext.setProperty(MDC_KEY, id);
    MDC.put(MDC_KEY, id);
  }

  @Override
  public void filter(final ContainerRequestContext requestContext,
                     final ContainerResponseContext responseContext) {
    Object id = requestContext.getProperty(MDC_KEY);
    if (id != null) {
      responseContext.getHeaders().putSingle(HEADER, id.toString());
    }
    MDC.remove(MDC_KEY);
  }
}
