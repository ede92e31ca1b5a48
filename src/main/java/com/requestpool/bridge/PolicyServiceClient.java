package com.requestpool.bridge;

/**
 * Client of the external policy service that owns fair-scheduler allocation and authorization rules.
 * Requests and responses are opaque serialized payloads (see {@link com.requestpool.wire.WireCodec}).
 * <p>
 * Implementations may call the service in-process, through an embedded runtime or over the network.
 * Calls are synchronous. A failed call throws
 * {@link com.requestpool.exception.PolicyServiceException} and is not retried.
 */
public interface PolicyServiceClient {

    /**
     * Resolve the pool for a serialized {@code ResolveRequestPoolParams}.
     *
     * @return Serialized {@code ResolveRequestPoolResult}
     */
    byte[] resolveRequestPool(byte[] params);

    /**
     * Look up the limits for a serialized {@code PoolConfigParams}.
     *
     * @return Serialized {@code PoolConfigResult}
     */
    byte[] getPoolConfig(byte[] params);
}
