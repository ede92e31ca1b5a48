package com.requestpool.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Admission-control limits of a pool.
 *
 * @param maxRequests Maximum concurrent requests, -1 for no limit
 * @param maxQueued   Maximum queued requests, zero or negative to queue nothing
 * @param memLimit    Memory limit in bytes, -1 for no limit
 */
public record PoolConfigResult(
        @JsonProperty("max_requests") long maxRequests,
        @JsonProperty("max_queued") long maxQueued,
        @JsonProperty("mem_limit") long memLimit
) {
    public static final long UNLIMITED = -1;

    public boolean hasRequestLimit() {
        return maxRequests >= 0;
    }

    public boolean hasMemLimit() {
        return memLimit != UNLIMITED;
    }

    public boolean allowsQueueing() {
        return maxQueued > 0;
    }
}
