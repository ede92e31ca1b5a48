package com.requestpool.resolver;

import com.requestpool.bridge.PolicyServiceFixtures;
import com.requestpool.config.MemSpecParser;
import com.requestpool.config.ResolverConfig;
import com.requestpool.config.ResolverConfigLoader;
import com.requestpool.exception.ConfigurationException;
import com.requestpool.model.PoolConfigResult;
import com.requestpool.policy.PolicyMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PoolResolverFactory startup results.
 */
class PoolResolverFactoryTest {

    @Test
    @DisplayName("Successful startup holds the resolver")
    void successfulStartup() {
        StartupResult result = PoolResolverFactory.create(ResolverConfig.defaults());

        assertTrue(result.isSuccess());
        assertNull(result.error());
        assertEquals(PolicyMode.DEFAULT_ONLY, result.resolver().mode());
    }

    @Test
    @DisplayName("Malformed memory limit yields a failed startup")
    void malformedMemLimit() {
        StartupResult result = PoolResolverFactory.create(ResolverConfig.defaultPool(-1, "1TB", 0));

        assertFalse(result.isSuccess());
        assertNotNull(result.error());
        ConfigurationException thrown = assertThrows(ConfigurationException.class, result::resolver);
        assertSame(result.error(), thrown);
    }

    @Test
    @DisplayName("Binding failure yields a failed startup before any request is served")
    void bindingFailure() {
        StartupResult result = PoolResolverFactory.create(ResolverConfig.delegated(
                "fair-scheduler.xml", "", "com.example.MissingPolicyService"));

        assertFalse(result.isSuccess());
        assertThrows(ConfigurationException.class, result::resolver);
    }

    @Test
    @DisplayName("Policy service start failure yields a failed startup")
    void startFailure() {
        StartupResult result = PoolResolverFactory.create(ResolverConfig.delegated(
                "fair-scheduler.xml", "", PolicyServiceFixtures.FailingStart.class.getName()));

        assertFalse(result.isSuccess());
        assertInstanceOf(IllegalArgumentException.class, result.error().getCause());
    }

    @Test
    @DisplayName("Configuration loaded from YAML starts the matching mode")
    void startFromYaml() {
        ClassLoader classLoader = getClass().getClassLoader();
        MemSpecParser memSpecParser = new MemSpecParser();

        PoolResolver defaultOnly = PoolResolverFactory.create(
                ResolverConfigLoader.load("classpath:config/default-pool.yaml"), classLoader, memSpecParser).resolver();
        assertEquals(new PoolConfigResult(10, 5, 1073741824L), defaultOnly.getPoolConfig("anything"));

        PoolResolver delegated = PoolResolverFactory.create(
                ResolverConfigLoader.load("classpath:config/delegated.yaml"), classLoader, memSpecParser).resolver();
        assertEquals("root.etl", delegated.resolveRequestPool("etl", "alice").resolvedPool());
    }
}
