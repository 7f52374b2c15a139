package com.codeheadsystems.portal.server.directory;

import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.model.directory.UserResponse;
import com.codeheadsystems.portal.model.self.ProfileResponse;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.role.GroupResolver;
import com.codeheadsystems.portal.server.role.Role;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the caller's own directory account.
 * <p>
 * The role is resolved from the token's groups, as everywhere else. If the directory's group list
 * cannot be read the token's groups are shown instead.
 */
@Singleton
public class SelfProfileReader {

  private static final Logger log = LoggerFactory.getLogger(SelfProfileReader.class);

  private final DirectoryAccessor directory;
  private final GroupResolver groupResolver;

  @Inject
  public SelfProfileReader(final DirectoryAccessor directory, final GroupResolver groupResolver) {
    this.directory = directory;
    this.groupResolver = groupResolver;
  }

  /**
   * The caller's profile.
   *
   * @param principal the caller
   * @return the profile
   * @throws PortalException {@link ErrorCode#NOT_FOUND} without a directory account
   */
  public ProfileResponse profile(final PortalPrincipal principal) {
    UserResponse user = directory.findUserByUsername(principal.username())
        .orElseThrow(() -> new PortalException(ErrorCode.NOT_FOUND, "user profile not found"));
    List<String> groups;
    try {
      groups = directory.userGroups(user.id()).stream().map(GroupResponse::name).toList();
    } catch (PortalException e) {
      log.warn("Could not read groups of {} for profile, using token groups: {}", user.id(), e.getMessage());
      groups = new ArrayList<>(principal.groups());
    }
    String role = groupResolver.tryResolve(principal.groups()).map(Role::name).orElse(null);
    return new ProfileResponse(user.id(), user.username(), user.email(), user.firstName(), user.lastName(),
        user.emailVerified(), groups, role);
  }
}
