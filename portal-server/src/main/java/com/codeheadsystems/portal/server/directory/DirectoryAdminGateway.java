package com.codeheadsystems.portal.server.directory;

import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.model.directory.GroupRequest;
import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.model.directory.ResetPasswordRequest;
import com.codeheadsystems.portal.model.directory.SessionResponse;
import com.codeheadsystems.portal.model.directory.UpdateUserRequest;
import com.codeheadsystems.portal.model.directory.UserResponse;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative operations on the directory, on behalf of an administrator.
 * <p>
 * Every mutation is audited before it returns. If the mutation succeeded but its audit record
 * cannot be written, the mutation stands and the call fails with
 * {@link ErrorCode#AUDIT_WRITE_FAILED}. Failed mutations are audited best-effort.
 * Callers must already have checked that the actor is an administrator.
 */
@Singleton
public class DirectoryAdminGateway {

  /** Largest page a caller may request. */
  public static final int MAX_PAGE_SIZE = 500;

  private static final int MAX_GROUP_NAME = 255;

  private static final Logger log = LoggerFactory.getLogger(DirectoryAdminGateway.class);

  private final DirectoryAccessor directory;
  private final AuditEmitter auditEmitter;
  private final Clock clock;

  /**
   * Instantiates a new Directory admin gateway.
   *
   * @param directory    the directory
   * @param auditEmitter the audit emitter
   * @param clock        the clock
   */
  @Inject
  public DirectoryAdminGateway(final DirectoryAccessor directory,
                               final AuditEmitter auditEmitter,
                               final Clock clock) {
    this.directory = directory;
    this.auditEmitter = auditEmitter;
    this.clock = clock;
  }

  // ── Reads ─────────────────────────────────────────────────────────────────

  /**
   * Lists users one page at a time.
   *
   * @param first  offset of the first user
   * @param max    page size, at most {@link #MAX_PAGE_SIZE}
   * @param search optional substring of username, email or name
   * @return the page
   * @throws PortalException {@link ErrorCode#INVALID_REQUEST} for an out-of-range page
   */
  public List<UserResponse> listUsers(final int first, final int max, final String search) {
    if (first < 0 || max < 1 || max > MAX_PAGE_SIZE) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "first must be >= 0 and max between 1 and " + MAX_PAGE_SIZE);
    }
    return directory.listUsers(first, max, search);
  }

  /**
   * Gets one user.
   *
   * @param userId the user id
   * @return the user
   * @throws PortalException {@link ErrorCode#NOT_FOUND} when there is no such user
   */
  public UserResponse getUser(final String userId) {
    return directory.getUser(userId);
  }

  /**
   * The groups a user belongs to directly.
   *
   * @param userId the user id
   * @return the groups
   */
  public List<GroupResponse> userGroups(final String userId) {
    return directory.userGroups(userId);
  }

  /**
   * All top-level groups in the realm.
   *
   * @return the groups
   */
  public List<GroupResponse> listGroups() {
    return directory.listGroups();
  }

  /**
   * Gets one group.
   *
   * @param groupId the group id
   * @return the group
   * @throws PortalException {@link ErrorCode#NOT_FOUND} when there is no such group
   */
  public GroupResponse getGroup(final String groupId) {
    return directory.getGroup(groupId);
  }

  /**
   * The user's active sessions with the identity provider.
   *
   * @param userId the user id
   * @return the sessions, possibly empty
   */
  public List<SessionResponse> userSessions(final String userId) {
    return directory.userSessions(userId);
  }

  // ── Mutations ─────────────────────────────────────────────────────────────

  /**
   * Creates a user.
   *
   * @param actor   the administrator
   * @param request the request
   * @return the new user's id
   */
  public String createUser(final PortalPrincipal actor, final CreateUserRequest request) {
    if (request == null || request.username() == null || request.username().isBlank()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "username is required");
    }
    return mutate(actor, AuditAction.USER_CREATED, request.username(), () -> directory.createUser(request));
  }

  public void updateUser(final PortalPrincipal actor, final String userId, final UpdateUserRequest request) {
    if (request == null) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "request body is required");
    }
    mutate(actor, AuditAction.USER_UPDATED, userId, () -> {
      directory.updateUser(userId, request);
      return null;
    });
  }

  public void deleteUser(final PortalPrincipal actor, final String userId) {
    mutate(actor, AuditAction.USER_DELETED, userId, () -> {
      directory.deleteUser(userId);
      return null;
    });
  }

  public void resetPassword(final PortalPrincipal actor, final String userId, final ResetPasswordRequest request) {
    if (request == null || request.password() == null || request.password().isEmpty()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "password is required");
    }
    mutate(actor, AuditAction.USER_PASSWORD_RESET, userId, () -> {
      directory.resetPassword(userId, request);
      return null;
    });
  }

  public void addUserToGroup(final PortalPrincipal actor, final String userId, final String groupId) {
    mutate(actor, AuditAction.GROUP_MEMBER_ADDED, userId + "->" + groupId, () -> {
      directory.addUserToGroup(userId, groupId);
      return null;
    });
  }

  public void removeUserFromGroup(final PortalPrincipal actor, final String userId, final String groupId) {
    mutate(actor, AuditAction.GROUP_MEMBER_REMOVED, userId + "->" + groupId, () -> {
      directory.removeUserFromGroup(userId, groupId);
      return null;
    });
  }

  /**
   * Creates a top-level group.
   *
   * @param actor   the administrator
   * @param request the request
   * @return the new group's id
   */
  public String createGroup(final PortalPrincipal actor, final GroupRequest request) {
    String name = groupName(request);
    return mutate(actor, AuditAction.GROUP_CREATED, name, () -> directory.createGroup(name));
  }

  public void updateGroup(final PortalPrincipal actor, final String groupId, final GroupRequest request) {
    String name = groupName(request);
    mutate(actor, AuditAction.GROUP_UPDATED, groupId, () -> {
      directory.renameGroup(groupId, name);
      return null;
    });
  }

  /**
   * Deletes a group. Members lose the role the group granted at their next token.
   *
   * @param actor   the administrator
   * @param groupId the group id
   */
  public void deleteGroup(final PortalPrincipal actor, final String groupId) {
    mutate(actor, AuditAction.GROUP_DELETED, groupId, () -> {
      directory.deleteGroup(groupId);
      return null;
    });
  }

  /**
   * Ends every identity-provider session of the user. Bearer tokens already issued stay valid
   * until they expire.
   *
   * @param actor  the administrator
   * @param userId the user id
   */
  public void logoutUser(final PortalPrincipal actor, final String userId) {
    mutate(actor, AuditAction.USER_LOGGED_OUT, userId, () -> {
      directory.logoutUser(userId);
      return null;
    });
  }

  private static String groupName(final GroupRequest request) {
    if (request == null || request.name() == null || request.name().isBlank()) {
      throw new PortalException(ErrorCode.INVALID_REQUEST, "name is required");
    }
    String name = request.name().trim();
    if (name.length() > MAX_GROUP_NAME || name.indexOf('/') >= 0) {
      throw new PortalException(ErrorCode.INVALID_REQUEST,
          "name must be at most " + MAX_GROUP_NAME + " characters and contain no '/'");
    }
    return name;
  }

  private <T> T mutate(final PortalPrincipal actor, final AuditAction action, final String target,
                       final Supplier<T> operation) {
    T result;
    try {
      result = operation.get();
    } catch (PortalException e) {
      auditEmitter.appendBestEffort(AuditEvent.of(actor.username(), action, target, clock.instant(),
          AuditResult.FAILURE, e.code().name()));
      throw e;
    }
    auditEmitter.append(AuditEvent.of(actor.username(), action, target, clock.instant(), AuditResult.SUCCESS, null));
    log.info("{} {} by {}", action, target, actor.username());
    return result;
  }
}
