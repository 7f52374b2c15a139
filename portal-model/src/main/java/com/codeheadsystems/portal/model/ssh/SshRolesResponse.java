package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Roles available to the caller, most privileged first.
 * <p>
 * Used by: {@code GET /api/v1/ssh/roles}
 *
 * @param defaultRole the role used when a sign request names none
 * @param roles       every role the caller may request
 */
public record SshRolesResponse(
    @JsonProperty("defaultRole") String defaultRole,
    @JsonProperty("roles") List<SshRoleResponse> roles) {
}
