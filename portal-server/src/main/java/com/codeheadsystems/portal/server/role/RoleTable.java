package com.codeheadsystems.portal.server.role;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of roles and the groups that map to them, built once from configuration.
 * <p>
 * Exactly one role may hold the lowest precedence rank; that role is the administrative role
 * gating the directory endpoints.
 */
public final class RoleTable {

  /** Orders roles from most to least privileged, ties broken by name. */
  public static final Comparator<Role> PRIVILEGE_ORDER =
      Comparator.comparingInt(Role::precedence).thenComparing(Role::name);

  private final Map<String, Role> rolesByName;
  private final Map<String, Role> rolesByGroup;
  private final Role administrativeRole;

  /**
   * Instantiates a new Role table.
   *
   * @param roles         the roles
   * @param groupMappings group name to role name, in declaration order
   * @throws IllegalArgumentException on duplicate roles, unknown role references, or an
   *                                  ambiguous top rank
   */
  public RoleTable(final List<Role> roles, final Map<String, String> groupMappings) {
    if (roles == null || roles.isEmpty()) {
      throw new IllegalArgumentException("at least one role is required");
    }
    Map<String, Role> byName = new LinkedHashMap<>();
    for (Role role : roles) {
      if (byName.put(role.name(), role) != null) {
        throw new IllegalArgumentException("duplicate role: " + role.name());
      }
    }
    Map<String, Role> byGroup = new LinkedHashMap<>();
    groupMappings.forEach((group, roleName) -> {
      Role role = byName.get(roleName);
      if (role == null) {
        throw new IllegalArgumentException("group " + group + " maps to unknown role " + roleName);
      }
      byGroup.put(group, role);
    });
    List<Role> sorted = roles.stream().sorted(PRIVILEGE_ORDER).toList();
    if (sorted.size() > 1 && sorted.get(0).precedence() == sorted.get(1).precedence()) {
      throw new IllegalArgumentException("roles " + sorted.get(0).name() + " and "
          + sorted.get(1).name() + " share the top precedence rank");
    }
    this.rolesByName = Collections.unmodifiableMap(byName);
    this.rolesByGroup = Collections.unmodifiableMap(byGroup);
    this.administrativeRole = sorted.get(0);
  }

  /**
   * Role by name.
   *
   * @param name the name
   * @return the role, if defined
   */
  public Optional<Role> role(final String name) {
    return Optional.ofNullable(rolesByName.get(name));
  }

  /**
   * Role a group maps to.
   *
   * @param group the normalised group name
   * @return the role, if the group is mapped
   */
  public Optional<Role> roleForGroup(final String group) {
    return Optional.ofNullable(rolesByGroup.get(group));
  }

  /**
   * All roles, most privileged first.
   *
   * @return the roles
   */
  public List<Role> roles() {
    return rolesByName.values().stream().sorted(PRIVILEGE_ORDER).toList();
  }

  /**
   * The single top-precedence role.
   *
   * @return the administrative role
   */
  public Role administrativeRole() {
    return administrativeRole;
  }
}
