package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One page of users.
 *
 * @param users the users on this page
 * @param first the offset of the first user
 * @param max   the page size requested
 */
public record UsersResponse(
    @JsonProperty("users") List<UserResponse> users,
    @JsonProperty("first") int first,
    @JsonProperty("max") int max) {
}
