package com.requestpool.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to resolve the pool a user's request should run in.
 *
 * @param user          User submitting the request
 * @param requestedPool Pool named by the request, may be empty
 */
public record ResolveRequestPoolParams(
        @JsonProperty("user") String user,
        @JsonProperty("requested_pool") String requestedPool
) {
}
