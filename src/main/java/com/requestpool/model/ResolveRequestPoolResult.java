package com.requestpool.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of pool resolution.
 *
 * @param resolvedPool Effective pool name
 * @param hasAccess    Whether the user may submit to the resolved pool
 */
public record ResolveRequestPoolResult(
        @JsonProperty("resolved_pool") String resolvedPool,
        @JsonProperty("has_access") boolean hasAccess
) {
    public static ResolveRequestPoolResult granted(String pool) {
        return new ResolveRequestPoolResult(pool, true);
    }
}
