package com.codeheadsystems.portal.dropwizard;

import com.codeheadsystems.portal.dropwizard.config.AuditConfiguration;
import com.codeheadsystems.portal.dropwizard.config.ClusterConfiguration;
import com.codeheadsystems.portal.dropwizard.config.OidcConfiguration;
import com.codeheadsystems.portal.dropwizard.config.RoleConfiguration;
import com.codeheadsystems.portal.dropwizard.config.VaultConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.util.Duration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the identity portal.
 * <p>
 * Secrets ({@code oidc.clientSecret} in particular) are expected to arrive through environment
 * variable substitution, e.g. {@code ${OIDC_CLIENT_SECRET}}, never literally in the file.
 * <p>
 * The {@code vault} block may be omitted only when the application supplies its own certificate
 * signer to {@link PortalBundle}.
 */
public class PortalConfiguration extends Configuration {

  /**
   * Identity provider settings.
   */
  @Valid
  @NotNull
  private OidcConfiguration oidc;

  /**
   * Credential store settings.
   */
  @Valid
  private VaultConfiguration vault;

  /**
   * The cluster generated kubeconfigs point at.
   */
  @Valid
  @NotNull
  private ClusterConfiguration cluster;

  /**
   * Roles and the directory groups granting them. One role must hold the unique top rank.
   */
  @Valid
  @NotEmpty
  private List<RoleConfiguration> roles = new ArrayList<>();

  @Valid
  @NotNull
  private AuditConfiguration audit = new AuditConfiguration();

  /**
   * Timeout of every call to the identity provider, the directory and the credential store.
   */
  @NotNull
  private Duration upstreamTimeout = Duration.seconds(10);

  /**
   * Gets oidc.
   *
   * @return the oidc block
   */
  @JsonProperty
  public OidcConfiguration getOidc() {
    return oidc;
  }

  /**
   * Sets oidc.
   *
   * @param oidc the oidc block
   */
  @JsonProperty
  public void setOidc(final OidcConfiguration oidc) {
    this.oidc = oidc;
  }

  /**
   * Gets vault.
   *
   * @return the vault block, or null
   */
  @JsonProperty
  public VaultConfiguration getVault() {
    return vault;
  }

  /**
   * Sets vault.
   *
   * @param vault the vault block
   */
  @JsonProperty
  public void setVault(final VaultConfiguration vault) {
    this.vault = vault;
  }

  /**
   * Gets cluster.
   *
   * @return the cluster block
   */
  @JsonProperty
  public ClusterConfiguration getCluster() {
    return cluster;
  }

  /**
   * Sets cluster.
   *
   * @param cluster the cluster block
   */
  @JsonProperty
  public void setCluster(final ClusterConfiguration cluster) {
    this.cluster = cluster;
  }

  /**
   * Gets roles.
   *
   * @return the roles
   */
  @JsonProperty
  public List<RoleConfiguration> getRoles() {
    return roles;
  }

  /**
   * Sets roles.
   *
   * @param roles the roles
   */
  @JsonProperty
  public void setRoles(final List<RoleConfiguration> roles) {
    this.roles = roles;
  }

  /**
   * Gets audit.
   *
   * @return the audit block
   */
  @JsonProperty
  public AuditConfiguration getAudit() {
    return audit;
  }

  /**
   * Sets audit.
   *
   * @param audit the audit block
   */
  @JsonProperty
  public void setAudit(final AuditConfiguration audit) {
    this.audit = audit;
  }

  /**
   * Gets upstream timeout.
   *
   * @return the upstream timeout
   */
  @JsonProperty
  public Duration getUpstreamTimeout() {
    return upstreamTimeout;
  }

  /**
   * Sets upstream timeout.
   *
   * @param upstreamTimeout the upstream timeout
   */
  @JsonProperty
  public void setUpstreamTimeout(final Duration upstreamTimeout) {
    this.upstreamTimeout = upstreamTimeout;
  }
}
