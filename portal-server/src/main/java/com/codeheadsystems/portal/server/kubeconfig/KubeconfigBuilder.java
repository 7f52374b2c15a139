package com.codeheadsystems.portal.server.kubeconfig;

import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Renders a kubeconfig whose user authenticates through {@code kubectl oidc-login}.
 * <p>
 * A pure function of its inputs: no network, no cache, and the same inputs always give the same
 * bytes. No token is embedded; kubectl obtains its own from the identity provider.
 */
public final class KubeconfigBuilder {

  /** Media type for the download. */
  public static final String MEDIA_TYPE = "application/x-yaml";

  private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
      .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
      .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
      .build());

  private KubeconfigBuilder() {
  }

  /**
   * Builds the kubeconfig.
   *
   * @param principal the user the kubeconfig is for
   * @param cluster   the cluster
   * @return the YAML document
   */
  public static String build(final PortalPrincipal principal, final ClusterSettings cluster) {
    String userName = principal.username() + "@" + cluster.name();
    Kubeconfig kubeconfig = new Kubeconfig(
        "v1",
        "Config",
        List.of(new NamedCluster(cluster.name(), new Cluster(cluster.apiServer(),
            Base64.getEncoder().encodeToString(cluster.caCertificate())))),
        List.of(new NamedContext(cluster.name(), new Context(cluster.name(), userName))),
        cluster.name(),
        Map.of(),
        List.of(new NamedUser(userName, new User(exec(cluster)))));
    try {
      return YAML.writeValueAsString(kubeconfig);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("kubeconfig could not be rendered", e);
    }
  }

  private static Exec exec(final ClusterSettings cluster) {
    List<String> args = new ArrayList<>();
    args.add("oidc-login");
    args.add("get-token");
    args.add("--oidc-issuer-url=" + cluster.issuerUrl());
    args.add("--oidc-client-id=" + cluster.clientId());
    cluster.extraScopes().forEach(scope -> args.add("--oidc-extra-scope=" + scope));
    return new Exec("client.authentication.k8s.io/v1beta1", "kubectl", args, "IfAvailable", false);
  }

  @JsonPropertyOrder({"apiVersion", "kind", "clusters", "contexts", "current-context", "preferences", "users"})
  record Kubeconfig(@JsonProperty("apiVersion") String apiVersion,
                    @JsonProperty("kind") String kind,
                    @JsonProperty("clusters") List<NamedCluster> clusters,
                    @JsonProperty("contexts") List<NamedContext> contexts,
                    @JsonProperty("current-context") String currentContext,
                    @JsonProperty("preferences") Map<String, Object> preferences,
                    @JsonProperty("users") List<NamedUser> users) {
  }

  @JsonPropertyOrder({"name", "cluster"})
  record NamedCluster(@JsonProperty("name") String name, @JsonProperty("cluster") Cluster cluster) {
  }

  @JsonPropertyOrder({"server", "certificate-authority-data"})
  record Cluster(@JsonProperty("server") String server,
                 @JsonProperty("certificate-authority-data") String certificateAuthorityData) {
  }

  @JsonPropertyOrder({"name", "context"})
  record NamedContext(@JsonProperty("name") String name, @JsonProperty("context") Context context) {
  }

  @JsonPropertyOrder({"cluster", "user"})
  record Context(@JsonProperty("cluster") String cluster, @JsonProperty("user") String user) {
  }

  @JsonPropertyOrder({"name", "user"})
  record NamedUser(@JsonProperty("name") String name, @JsonProperty("user") User user) {
  }

  record User(@JsonProperty("exec") Exec exec) {
  }

  @JsonPropertyOrder({"apiVersion", "command", "args", "interactiveMode", "provideClusterInfo"})
  record Exec(@JsonProperty("apiVersion") String apiVersion,
              @JsonProperty("command") String command,
              @JsonProperty("args") List<String> args,
              @JsonProperty("interactiveMode") String interactiveMode,
              @JsonProperty("provideClusterInfo") boolean provideClusterInfo) {
  }
}
