package com.requestpool.resolver;

import com.requestpool.config.MemSpecParser;
import com.requestpool.config.ResolverConfig;
import com.requestpool.exception.ConfigurationException;
import com.requestpool.policy.PolicyEngine;
import com.requestpool.policy.PolicyEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the resolver startup sequence.
 */
public final class PoolResolverFactory {

    private static final Logger log = LoggerFactory.getLogger(PoolResolverFactory.class);

    private PoolResolverFactory() {
    }

    public static StartupResult create(ResolverConfig config) {
        return create(config, Thread.currentThread().getContextClassLoader(), new MemSpecParser());
    }

    /**
     * Build the resolver for the given config.
     *
     * @param config        Resolver configuration
     * @param classLoader   Loader for the policy service class in delegated mode
     * @param memSpecParser Parser for the default pool memory limit
     * @return Started resolver, or the configuration error that stopped it
     */
    public static StartupResult create(ResolverConfig config, ClassLoader classLoader, MemSpecParser memSpecParser) {
        try {
            PolicyEngine engine = PolicyEngineFactory.create(config, classLoader, memSpecParser);
            log.info("PoolResolver started in {} mode", engine.mode());
            return StartupResult.succeeded(new PoolResolver(engine));
        } catch (ConfigurationException e) {
            log.error("PoolResolver failed to start: {}", e.getMessage());
            return StartupResult.failed(e);
        }
    }
}
