package com.requestpool.resolver;

import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolResult;
import com.requestpool.policy.PolicyEngine;
import com.requestpool.policy.PolicyMode;

import java.util.Objects;

/**
 * Resolves request pools and their admission-control limits.
 * <p>
 * One instance is created at process startup (see {@link PoolResolverFactory}) and passed to every
 * component that admits requests. The engine, and with it the mode, is fixed at construction; the
 * resolver holds no mutable state and is safe for concurrent callers. Enforcing the returned limits
 * is the caller's job.
 */
public class PoolResolver {

    private final PolicyEngine engine;

    public PoolResolver(PolicyEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Resolve the pool for a request.
     *
     * @param requestedPool Pool named by the request, may be empty
     * @param user          User submitting the request
     * @return Resolved pool and whether the user may submit to it
     * @throws com.requestpool.exception.PolicyServiceException if a delegated lookup fails
     */
    public ResolveRequestPoolResult resolveRequestPool(String requestedPool, String user) {
        return engine.resolveRequestPool(requestedPool, user);
    }

    /**
     * Get the admission-control limits of a pool.
     *
     * @param pool Resolved pool name
     * @return Pool limits
     * @throws com.requestpool.exception.PolicyServiceException if a delegated lookup fails
     */
    public PoolConfigResult getPoolConfig(String pool) {
        return engine.getPoolConfig(pool);
    }

    public PolicyMode mode() {
        return engine.mode();
    }

    public boolean isDefaultPoolOnly() {
        return engine.mode() == PolicyMode.DEFAULT_ONLY;
    }
}
