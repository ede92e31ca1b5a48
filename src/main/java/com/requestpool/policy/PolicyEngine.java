package com.requestpool.policy;

import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolResult;

/**
 * Answers pool resolution and pool config lookups.
 * Implementations are immutable after construction and safe for concurrent callers.
 */
public interface PolicyEngine {

    /**
     * Resolve the pool a request should run in and whether the user may submit to it.
     *
     * @param requestedPool Pool named by the request, may be empty
     * @param user          User submitting the request
     * @return Resolved pool and access decision
     * @throws com.requestpool.exception.PolicyServiceException if the lookup fails
     */
    ResolveRequestPoolResult resolveRequestPool(String requestedPool, String user);

    /**
     * Get the admission-control limits of a pool.
     *
     * @param pool Resolved pool name
     * @return Pool limits
     * @throws com.requestpool.exception.PolicyServiceException if the lookup fails
     */
    PoolConfigResult getPoolConfig(String pool);

    PolicyMode mode();
}
