package com.codeheadsystems.portal.server.directory;

import com.codeheadsystems.portal.model.directory.CreateUserRequest;
import com.codeheadsystems.portal.model.directory.GroupResponse;
import com.codeheadsystems.portal.model.directory.ResetPasswordRequest;
import com.codeheadsystems.portal.model.directory.SessionResponse;
import com.codeheadsystems.portal.model.directory.UpdateUserRequest;
import com.codeheadsystems.portal.model.directory.UserResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The identity provider's user and group store.
 * <p>
 * Failures surface as {@link com.codeheadsystems.portal.server.exception.PortalException} with
 * {@code CONFLICT}, {@code NOT_FOUND}, {@code INVALID_REQUEST} or {@code UPSTREAM_UNAVAILABLE}.
 */
public interface DirectoryAccessor {

  List<UserResponse> listUsers(int first, int max, String search);

  UserResponse getUser(String userId);

  /**
   * Creates a user.
   *
   * @param request the request
   * @return the new user's id
   */
  String createUser(CreateUserRequest request);

  void updateUser(String userId, UpdateUserRequest request);

  void deleteUser(String userId);

  void resetPassword(String userId, ResetPasswordRequest request);

  List<GroupResponse> userGroups(String userId);

  void addUserToGroup(String userId, String groupId);

  void removeUserFromGroup(String userId, String groupId);

  List<GroupResponse> listGroups();

  GroupResponse getGroup(String groupId);

  /**
   * Creates a top-level group.
   *
   * @param name the group name
   * @return the new group's id
   */
  String createGroup(String name);

  void renameGroup(String groupId, String name);

  void deleteGroup(String groupId);

  List<SessionResponse> userSessions(String userId);

  /**
   * Ends every provider session of the user.
   *
   * @param userId the user
   */
  void logoutUser(String userId);

  /**
   * Exact-match lookup by login name.
   *
   * @param username the login name
   * @return the user, if one exists
   */
  Optional<UserResponse> findUserByUsername(String username);

  /**
   * Custom attributes of a user, first value of each.
   *
   * @param userId the user
   * @return attribute name to value
   */
  Map<String, String> userAttributes(String userId);

  /**
   * Sets attributes, leaving the others untouched. A null value removes the attribute.
   *
   * @param userId  the user
   * @param changes attribute name to new value
   */
  void updateUserAttributes(String userId, Map<String, String> changes);
}
