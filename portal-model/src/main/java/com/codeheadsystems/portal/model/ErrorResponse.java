package com.codeheadsystems.portal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body returned for every failed request.
 *
 * @param code      the stable machine-readable error code, e.g. {@code NO_ELIGIBLE_ROLE}
 * @param error     a human-readable message safe to show to the caller
 * @param requestId the request id echoed in the {@code X-Request-ID} header
 */
public record ErrorResponse(
    @JsonProperty("code") String code,
    @JsonProperty("error") String error,
    @JsonProperty("requestId") String requestId) {
}
