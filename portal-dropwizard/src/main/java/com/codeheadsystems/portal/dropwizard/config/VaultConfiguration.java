package com.codeheadsystems.portal.dropwizard.config;

import com.codeheadsystems.portal.server.vault.PlatformTokenReader;
import com.codeheadsystems.portal.server.vault.VaultSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.nio.file.Path;

/**
 * The {@code vault:} block: the credential store holding the SSH CA.
 */
public class VaultConfiguration {

  @NotNull
  private URI address;

  @NotEmpty
  private String sshMount = "ssh-client-signer";

  /**
   * The platform auth method mount, e.g. {@code kubernetes}.
   */
  @NotEmpty
  private String authPath = "kubernetes";

  @NotEmpty
  private String authRole = "identity-portal";

  /**
   * File holding the workload identity token presented at login.
   */
  @NotEmpty
  private String tokenPath = PlatformTokenReader.DEFAULT_PATH.toString();

  /**
   * Fraction of the lease after which renewal starts.
   */
  @DecimalMin(value = "0.0", inclusive = false)
  @DecimalMax(value = "1.0", inclusive = false)
  private double renewFraction = 2.0 / 3.0;

  @NotNull
  private Duration initialBackoff = Duration.seconds(1);

  @NotNull
  private Duration maxBackoff = Duration.seconds(30);

  @Min(1)
  private int maxRenewAttempts = 5;

  @NotNull
  private Duration stopTimeout = Duration.seconds(10);

  @JsonProperty
  public URI getAddress() {
    return address;
  }

  @JsonProperty
  public void setAddress(final URI address) {
    this.address = address;
  }

  @JsonProperty
  public String getSshMount() {
    return sshMount;
  }

  @JsonProperty
  public void setSshMount(final String sshMount) {
    this.sshMount = sshMount;
  }

  @JsonProperty
  public String getAuthPath() {
    return authPath;
  }

  @JsonProperty
  public void setAuthPath(final String authPath) {
    this.authPath = authPath;
  }

  @JsonProperty
  public String getAuthRole() {
    return authRole;
  }

  @JsonProperty
  public void setAuthRole(final String authRole) {
    this.authRole = authRole;
  }

  @JsonProperty
  public String getTokenPath() {
    return tokenPath;
  }

  @JsonProperty
  public void setTokenPath(final String tokenPath) {
    this.tokenPath = tokenPath;
  }

  @JsonProperty
  public double getRenewFraction() {
    return renewFraction;
  }

  @JsonProperty
  public void setRenewFraction(final double renewFraction) {
    this.renewFraction = renewFraction;
  }

  @JsonProperty
  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  @JsonProperty
  public void setInitialBackoff(final Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  @JsonProperty
  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  @JsonProperty
  public void setMaxBackoff(final Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  @JsonProperty
  public int getMaxRenewAttempts() {
    return maxRenewAttempts;
  }

  @JsonProperty
  public void setMaxRenewAttempts(final int maxRenewAttempts) {
    this.maxRenewAttempts = maxRenewAttempts;
  }

  @JsonProperty
  public Duration getStopTimeout() {
    return stopTimeout;
  }

  @JsonProperty
  public void setStopTimeout(final Duration stopTimeout) {
    this.stopTimeout = stopTimeout;
  }

  /**
   * The client settings.
   *
   * @return the settings
   */
  public VaultSettings toSettings() {
    return new VaultSettings(address, sshMount, authPath, authRole, renewFraction,
        Durations.toJava(initialBackoff), Durations.toJava(maxBackoff), maxRenewAttempts,
        Durations.toJava(stopTimeout));
  }

  /**
   * Reads the workload identity token at each login.
   *
   * @return the reader
   */
  public PlatformTokenReader tokenReader() {
    return new PlatformTokenReader(Path.of(tokenPath));
  }
}
