package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user account held by the identity provider.
 *
 * @param id               the provider's user id
 * @param username         the login name
 * @param email            the email address
 * @param firstName        the given name
 * @param lastName         the family name
 * @param enabled          whether the account can log in
 * @param emailVerified    whether the email address was verified
 * @param createdTimestamp creation time in epoch milliseconds
 */
public record UserResponse(
    @JsonProperty("id") String id,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("emailVerified") boolean emailVerified,
    @JsonProperty("createdTimestamp") long createdTimestamp) {
}
