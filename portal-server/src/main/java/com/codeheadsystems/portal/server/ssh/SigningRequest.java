package com.codeheadsystems.portal.server.ssh;

import com.codeheadsystems.portal.model.ssh.SshSignRequest;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import java.time.Duration;
import java.time.Instant;

/**
 * A caller's request for a certificate, as received.
 *
 * @param publicKey     the submitted public key line
 * @param requestedRole the requested role name, may be null
 * @param requester     the caller
 * @param requestedAt   when the request arrived
 * @param requestedTtl  the requested validity, may be null
 * @param requestId     the request id
 */
public record SigningRequest(String publicKey,
                             String requestedRole,
                             PortalPrincipal requester,
                             Instant requestedAt,
                             Duration requestedTtl,
                             String requestId) {

  /**
   * From the wire request.
   *
   * @param request     the wire request
   * @param requester   the caller
   * @param requestedAt the arrival time
   * @param requestId   the request id
   * @return the signing request
   */
  public static SigningRequest from(final SshSignRequest request,
                                    final PortalPrincipal requester,
                                    final Instant requestedAt,
                                    final String requestId) {
    Duration ttl = request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
    return new SigningRequest(request.publicKey(), request.role(), requester, requestedAt, ttl, requestId);
  }
}
