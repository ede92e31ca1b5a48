package com.requestpool.policy;

import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Policy engine used when no policy files are configured.
 * Every request resolves to {@link #DEFAULT_POOL_NAME} with access granted, and every pool has the
 * same static limits.
 */
public class LocalDefaultPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(LocalDefaultPolicyEngine.class);

    /**
     * Pool name used when the configuration files are not specified.
     */
    public static final String DEFAULT_POOL_NAME = "default-pool";

    private final ResolveRequestPoolResult resolved;
    private final PoolConfigResult poolConfig;

    /**
     * @param maxRequests Maximum concurrent requests, negative for no limit
     * @param maxQueued   Maximum queued requests
     * @param memLimit    Memory limit in bytes, -1 for no limit
     */
    public LocalDefaultPolicyEngine(long maxRequests, long maxQueued, long memLimit) {
        this.resolved = ResolveRequestPoolResult.granted(DEFAULT_POOL_NAME);
        this.poolConfig = new PoolConfigResult(maxRequests, maxQueued, memLimit);

        log.info("PolicyEngine initialized for {}: max-requests={}, max-queued={}, mem-limit={}",
                DEFAULT_POOL_NAME, maxRequests, maxQueued, memLimit);
    }

    @Override
    public ResolveRequestPoolResult resolveRequestPool(String requestedPool, String user) {
        return resolved;
    }

    @Override
    public PoolConfigResult getPoolConfig(String pool) {
        return poolConfig;
    }

    @Override
    public PolicyMode mode() {
        return PolicyMode.DEFAULT_ONLY;
    }
}
