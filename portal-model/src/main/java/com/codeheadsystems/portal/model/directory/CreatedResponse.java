package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Id of a newly created directory object.
 *
 * @param id the provider's id
 */
public record CreatedResponse(@JsonProperty("id") String id) {
}
