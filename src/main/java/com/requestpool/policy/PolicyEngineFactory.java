package com.requestpool.policy;

import com.requestpool.bridge.ReflectivePolicyServiceClient;
import com.requestpool.config.MemSpecParser;
import com.requestpool.config.ResolverConfig;
import com.requestpool.exception.ConfigurationException;
import com.requestpool.wire.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating PolicyEngine implementations based on config.
 */
public final class PolicyEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngineFactory.class);

    private PolicyEngineFactory() {
    }

    public static PolicyEngine create(ResolverConfig config) {
        return create(config, Thread.currentThread().getContextClassLoader(), new MemSpecParser());
    }

    /**
     * Create the engine for the given config.
     *
     * @param config        Resolver configuration
     * @param classLoader   Loader for the policy service class in delegated mode
     * @param memSpecParser Parser for the default pool memory limit
     * @return Engine in the mode the config selects
     * @throws ConfigurationException if the config is invalid or the policy service cannot be started
     */
    public static PolicyEngine create(ResolverConfig config, ClassLoader classLoader, MemSpecParser memSpecParser) {
        if (config.defaultPoolOnly()) {
            return createDefaultOnly(config, memSpecParser);
        }
        if (config.fairSchedulerAllocationPath().isEmpty()) {
            throw new ConfigurationException("llama-site-path is set to '" + config.llamaSitePath()
                    + "' but fair-scheduler-allocation-path is not");
        }

        log.info("Delegating pool resolution to {}", config.policyServiceClass());
        ReflectivePolicyServiceClient client = ReflectivePolicyServiceClient.bind(
                config.policyServiceClass(), classLoader,
                config.fairSchedulerAllocationPath(), config.llamaSitePath());
        return new DelegatedPolicyEngine(client, new WireCodec());
    }

    private static PolicyEngine createDefaultOnly(ResolverConfig config, MemSpecParser memSpecParser) {
        long bytesLimit;
        try {
            bytesLimit = memSpecParser.parse(config.defaultPoolMemLimit());
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Unable to parse default pool mem limit from '"
                    + config.defaultPoolMemLimit() + "'.", e);
        }
        // 0 means not set
        long memLimit = bytesLimit == 0 ? -1 : bytesLimit;
        return new LocalDefaultPolicyEngine(config.defaultPoolMaxRequests(), config.defaultPoolMaxQueued(), memLimit);
    }
}
