package com.codeheadsystems.portal.server.http;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for the upstream accessors.
 */
public final class HttpExchanges {

  private static final Logger log = LoggerFactory.getLogger(HttpExchanges.class);

  private HttpExchanges() {
  }

  /**
   * Sends the request and returns the response whatever its status. Transport failures become
   * {@link ErrorCode#UPSTREAM_UNAVAILABLE}; an interrupt is preserved on the calling thread.
   *
   * @param httpClient the http client
   * @param request    the request, which must carry a timeout
   * @param upstream   the collaborator name used in messages
   * @return the response
   */
  public static HttpResponse<String> send(final HttpClient httpClient,
                                          final HttpRequest request,
                                          final String upstream) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      log.debug("{} {} {} -> {}", upstream, request.method(), request.uri().getPath(), response.statusCode());
      return response;
    } catch (IOException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, upstream + " is unreachable", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, upstream + " request interrupted", e);
    }
  }

  /**
   * Encodes an {@code application/x-www-form-urlencoded} body. Null values are skipped.
   *
   * @param fields the fields, in order
   * @return the body
   */
  public static String form(final Map<String, String> fields) {
    return fields.entrySet().stream()
        .filter(e -> e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  /**
   * URL-encodes a single value.
   *
   * @param value the value
   * @return the encoded value
   */
  public static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  /**
   * Whether the status is 2xx.
   *
   * @param status the status
   * @return true on success
   */
  public static boolean isSuccess(final int status) {
    return status >= 200 && status < 300;
  }
}
