package com.codeheadsystems.portal.server.kubeconfig;

import java.util.Arrays;
import java.util.List;

/**
 * What a kubeconfig needs to know about the cluster and the identity provider.
 *
 * @param name          the cluster name, also used for the context
 * @param apiServer     the API server URL
 * @param caCertificate the cluster CA certificate, PEM bytes
 * @param issuerUrl     the OIDC issuer URL
 * @param clientId      the OIDC client id kubectl authenticates as
 * @param extraScopes   scopes kubectl asks for besides {@code openid}
 */
public record ClusterSettings(String name,
                              String apiServer,
                              byte[] caCertificate,
                              String issuerUrl,
                              String clientId,
                              List<String> extraScopes) {

  /**
   * Copies the mutable inputs.
   */
  public ClusterSettings {
    caCertificate = caCertificate.clone();
    extraScopes = List.copyOf(extraScopes);
  }

  @Override
  public byte[] caCertificate() {
    return caCertificate.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof ClusterSettings other
        && name.equals(other.name)
        && apiServer.equals(other.apiServer)
        && Arrays.equals(caCertificate, other.caCertificate)
        && issuerUrl.equals(other.issuerUrl)
        && clientId.equals(other.clientId)
        && extraScopes.equals(other.extraScopes);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(caCertificate);
  }

  @Override
  public String toString() {
    return "ClusterSettings[name=" + name + ", apiServer=" + apiServer + "]";
  }
}
