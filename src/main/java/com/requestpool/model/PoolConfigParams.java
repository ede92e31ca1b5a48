package com.requestpool.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request for a pool's admission-control limits.
 *
 * @param pool Resolved pool name
 */
public record PoolConfigParams(
        @JsonProperty("pool") String pool
) {
}
