package com.codeheadsystems.portal.dropwizard.config;

import com.codeheadsystems.portal.server.kubeconfig.ClusterSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code cluster:} block: the Kubernetes cluster generated kubeconfigs point at.
 * <p>
 * The CA certificate is given either inline ({@code caCertificate}, PEM) or as a file
 * ({@code caCertificatePath}); exactly one must be set.
 */
public class ClusterConfiguration {

  @NotEmpty
  private String name;

  @NotEmpty
  private String apiServer;

  private String caCertificate;

  private String caCertificatePath;

  /**
   * Client id kubectl logs in with. Defaults to the portal's own client id.
   */
  private String clientId;

  private List<String> extraScopes = new ArrayList<>();

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public void setName(final String name) {
    this.name = name;
  }

  @JsonProperty
  public String getApiServer() {
    return apiServer;
  }

  @JsonProperty
  public void setApiServer(final String apiServer) {
    this.apiServer = apiServer;
  }

  @JsonProperty
  public String getCaCertificate() {
    return caCertificate;
  }

  @JsonProperty
  public void setCaCertificate(final String caCertificate) {
    this.caCertificate = caCertificate;
  }

  @JsonProperty
  public String getCaCertificatePath() {
    return caCertificatePath;
  }

  @JsonProperty
  public void setCaCertificatePath(final String caCertificatePath) {
    this.caCertificatePath = caCertificatePath;
  }

  @JsonProperty
  public String getClientId() {
    return clientId;
  }

  @JsonProperty
  public void setClientId(final String clientId) {
    this.clientId = clientId;
  }

  @JsonProperty
  public List<String> getExtraScopes() {
    return extraScopes;
  }

  @JsonProperty
  public void setExtraScopes(final List<String> extraScopes) {
    this.extraScopes = extraScopes;
  }

  /**
   * Resolves the cluster settings, reading the CA file if one is configured.
   *
   * @param issuerUrl       the OIDC issuer kubectl logs in to
   * @param defaultClientId the client id used when none is configured here
   * @return the settings
   * @throws IllegalStateException when the CA is missing, doubly given or unreadable
   */
  public ClusterSettings toSettings(final String issuerUrl, final String defaultClientId) {
    boolean inline = caCertificate != null && !caCertificate.isBlank();
    boolean file = caCertificatePath != null && !caCertificatePath.isBlank();
    if (inline == file) {
      throw new IllegalStateException("cluster: set exactly one of caCertificate and caCertificatePath");
    }
    byte[] ca;
    if (inline) {
      ca = caCertificate.getBytes(StandardCharsets.US_ASCII);
    } else {
      try {
        ca = Files.readAllBytes(Path.of(caCertificatePath));
      } catch (IOException e) {
        throw new IllegalStateException("cluster CA certificate unreadable: " + caCertificatePath, e);
      }
    }
    String kubectlClientId = clientId == null || clientId.isBlank() ? defaultClientId : clientId;
    return new ClusterSettings(name, apiServer, ca, issuerUrl, kubectlClientId, extraScopes);
  }
}
