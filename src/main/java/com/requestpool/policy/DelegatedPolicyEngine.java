package com.requestpool.policy;

import com.requestpool.bridge.PolicyServiceClient;
import com.requestpool.model.PoolConfigParams;
import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolParams;
import com.requestpool.model.ResolveRequestPoolResult;
import com.requestpool.wire.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Policy engine that forwards every lookup to the external policy service.
 * Failures are surfaced to the caller as {@link com.requestpool.exception.PolicyServiceException};
 * nothing is retried.
 */
public class DelegatedPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(DelegatedPolicyEngine.class);

    private final PolicyServiceClient client;
    private final WireCodec codec;

    public DelegatedPolicyEngine(PolicyServiceClient client, WireCodec codec) {
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ResolveRequestPoolResult resolveRequestPool(String requestedPool, String user) {
        log.debug("Resolving pool '{}' for user {}", requestedPool, user);
        byte[] request = codec.encode(new ResolveRequestPoolParams(user, requestedPool));
        ResolveRequestPoolResult result = codec.decode(
                client.resolveRequestPool(request), ResolveRequestPoolResult.class);
        log.debug("Pool '{}' for user {} resolved to '{}', access={}",
                requestedPool, user, result.resolvedPool(), result.hasAccess());
        return result;
    }

    @Override
    public PoolConfigResult getPoolConfig(String pool) {
        log.debug("Fetching config for pool '{}'", pool);
        byte[] request = codec.encode(new PoolConfigParams(pool));
        return codec.decode(client.getPoolConfig(request), PoolConfigResult.class);
    }

    @Override
    public PolicyMode mode() {
        return PolicyMode.DELEGATED;
    }
}
