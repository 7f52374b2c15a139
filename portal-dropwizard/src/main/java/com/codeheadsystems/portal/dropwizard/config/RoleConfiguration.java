package com.codeheadsystems.portal.dropwizard.config;

import com.codeheadsystems.portal.server.role.Role;
import com.codeheadsystems.portal.server.role.RoleTable;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the {@code roles:} list: a role and the directory groups that grant it.
 */
public class RoleConfiguration {

  @NotEmpty
  private String name;

  /**
   * The credential store's signing role name.
   */
  @NotEmpty
  private String signingRole;

  @NotNull
  private Duration maxTtl;

  @NotEmpty
  private List<String> principals = new ArrayList<>();

  /**
   * Precedence rank; 0 is the most privileged, and the single top-ranked role administers the
   * directory.
   */
  @Min(0)
  private int rank;

  private List<String> groups = new ArrayList<>();

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public void setName(final String name) {
    this.name = name;
  }

  @JsonProperty
  public String getSigningRole() {
    return signingRole;
  }

  @JsonProperty
  public void setSigningRole(final String signingRole) {
    this.signingRole = signingRole;
  }

  @JsonProperty
  public Duration getMaxTtl() {
    return maxTtl;
  }

  @JsonProperty
  public void setMaxTtl(final Duration maxTtl) {
    this.maxTtl = maxTtl;
  }

  @JsonProperty
  public List<String> getPrincipals() {
    return principals;
  }

  @JsonProperty
  public void setPrincipals(final List<String> principals) {
    this.principals = principals;
  }

  @JsonProperty
  public int getRank() {
    return rank;
  }

  @JsonProperty
  public void setRank(final int rank) {
    this.rank = rank;
  }

  @JsonProperty
  public List<String> getGroups() {
    return groups;
  }

  @JsonProperty
  public void setGroups(final List<String> groups) {
    this.groups = groups;
  }

  /**
   * The role.
   *
   * @return the role
   */
  public Role toRole() {
    return new Role(name, signingRole, Durations.toJava(maxTtl), principals, rank);
  }

  /**
   * Builds the role table from the configured roles.
   *
   * @param roles the configured roles
   * @return the table
   * @throws IllegalStateException when the roles are inconsistent, e.g. a group granting two roles
   */
  public static RoleTable toTable(final List<RoleConfiguration> roles) {
    List<Role> built = new ArrayList<>();
    Map<String, String> groupToRole = new LinkedHashMap<>();
    try {
      for (RoleConfiguration role : roles) {
        built.add(role.toRole());
        for (String group : role.getGroups()) {
          String previous = groupToRole.putIfAbsent(group, role.getName());
          if (previous != null) {
            throw new IllegalStateException("group " + group + " is mapped to both " + previous + " and "
                + role.getName());
          }
        }
      }
      return new RoleTable(built, groupToRole);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("invalid roles configuration: " + e.getMessage(), e);
    }
  }
}
