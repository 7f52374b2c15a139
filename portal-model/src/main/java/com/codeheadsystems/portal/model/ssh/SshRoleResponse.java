package com.codeheadsystems.portal.model.ssh;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One role the caller may request a certificate for.
 *
 * @param name          the role name
 * @param maxTtlSeconds the longest lifetime a certificate under this role may have
 * @param principals    the principals certificates under this role carry
 */
public record SshRoleResponse(
    @JsonProperty("name") String name,
    @JsonProperty("maxTtlSeconds") long maxTtlSeconds,
    @JsonProperty("principals") List<String> principals) {
}
