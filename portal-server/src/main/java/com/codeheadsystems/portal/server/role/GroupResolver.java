package com.codeheadsystems.portal.server.role;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a principal's groups to the one role they act under.
 * <p>
 * Resolution is a pure function of the group set and the {@link RoleTable}: among the roles the
 * groups map to, the lowest precedence rank wins, then the lexically smallest role name, then the
 * lexically smallest group name.
 */
@Singleton
public class GroupResolver {

  private static final Logger log = LoggerFactory.getLogger(GroupResolver.class);

  private static final Comparator<Map.Entry<String, Role>> MATCH_ORDER =
      Comparator.<Map.Entry<String, Role>, Role>comparing(Map.Entry::getValue, RoleTable.PRIVILEGE_ORDER)
          .thenComparing(Map.Entry::getKey);

  private final RoleTable roleTable;

  /**
   * Instantiates a new Group resolver.
   *
   * @param roleTable the role table
   */
  @Inject
  public GroupResolver(final RoleTable roleTable) {
    this.roleTable = roleTable;
  }

  /**
   * Resolves the groups to a role.
   *
   * @param groups the normalised group names
   * @return the role
   * @throws PortalException {@link ErrorCode#NO_ELIGIBLE_ROLE} when no group is mapped
   */
  public Role resolve(final Collection<String> groups) {
    return tryResolve(groups).orElseThrow(() ->
        new PortalException(ErrorCode.NO_ELIGIBLE_ROLE, "none of your groups grants a role"));
  }

  /**
   * Resolves the groups to a role, if any.
   *
   * @param groups the normalised group names
   * @return the role, or empty when no group is mapped
   */
  public Optional<Role> tryResolve(final Collection<String> groups) {
    Optional<Role> role = groups.stream()
        .flatMap(group -> roleTable.roleForGroup(group).map(r -> Map.entry(group, r)).stream())
        .min(MATCH_ORDER)
        .map(Map.Entry::getValue);
    log.debug("resolve(groups={}) -> {}", groups, role.map(Role::name).orElse(null));
    return role;
  }

  /**
   * Resolves the role for a request that may name one. The named role must be the resolved role
   * or rank strictly below it.
   *
   * @param groups        the normalised group names
   * @param requestedRole the requested role name, null or blank for the default
   * @return the role to act under
   * @throws PortalException {@link ErrorCode#NO_ELIGIBLE_ROLE} or {@link ErrorCode#FORBIDDEN}
   */
  public Role resolveRequested(final Collection<String> groups, final String requestedRole) {
    Role resolved = resolve(groups);
    if (requestedRole == null || requestedRole.isBlank() || requestedRole.equals(resolved.name())) {
      return resolved;
    }
    Role requested = roleTable.role(requestedRole).orElseThrow(() ->
        new PortalException(ErrorCode.FORBIDDEN, "unknown role: " + requestedRole));
    if (requested.precedence() <= resolved.precedence()) {
      log.info("Refused role {} for caller resolved to {}", requested.name(), resolved.name());
      throw new PortalException(ErrorCode.FORBIDDEN, "role " + requestedRole + " is not available to you");
    }
    return requested;
  }

  /**
   * The resolved role followed by every strictly less privileged role.
   *
   * @param groups the normalised group names
   * @return the eligible roles, most privileged first
   */
  public List<Role> eligibleRoles(final Collection<String> groups) {
    Role resolved = resolve(groups);
    return roleTable.roles().stream()
        .filter(role -> role.equals(resolved) || role.precedence() > resolved.precedence())
        .toList();
  }

  /**
   * Whether the groups resolve to the administrative role.
   *
   * @param groups the normalised group names
   * @return true for administrators
   */
  public boolean isAdministrator(final Collection<String> groups) {
    return tryResolve(groups).map(roleTable.administrativeRole()::equals).orElse(false);
  }
}
