package com.requestpool.policy;

import com.requestpool.bridge.PolicyServiceFixtures;
import com.requestpool.config.MemSpecParser;
import com.requestpool.config.ResolverConfig;
import com.requestpool.exception.ConfigurationException;
import com.requestpool.model.PoolConfigResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PolicyEngineFactory.
 */
class PolicyEngineFactoryTest {

    private final ClassLoader classLoader = getClass().getClassLoader();
    private final MemSpecParser memSpecParser = new MemSpecParser(() -> 16L * 1024 * 1024 * 1024);

    @Test
    @DisplayName("No policy files selects the default-only engine")
    void shouldCreateDefaultOnlyEngine() {
        PolicyEngine engine = create(ResolverConfig.defaultPool(10, "1G", 5));

        assertInstanceOf(LocalDefaultPolicyEngine.class, engine);
        assertEquals(new PoolConfigResult(10, 5, 1073741824L), engine.getPoolConfig("anything"));
    }

    @ParameterizedTest
    @DisplayName("Unset memory limits become -1")
    @CsvSource(value = {"'', -1", "0, -1", "-1, -1", "500, 500", "25%, 4294967296"})
    void shouldNormalizeMemLimit(String spec, long expected) {
        PolicyEngine engine = create(ResolverConfig.defaultPool(-1, spec, 0));

        assertEquals(expected, engine.getPoolConfig("default-pool").memLimit());
    }

    @Test
    @DisplayName("Malformed memory limit fails startup")
    void shouldFailForMalformedMemLimit() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> create(ResolverConfig.defaultPool(-1, "lots", 0)));
        assertTrue(e.getMessage().contains("'lots'"));
    }

    @Test
    @DisplayName("Allocation file selects the delegated engine")
    void shouldCreateDelegatedEngine() {
        PolicyEngine engine = create(ResolverConfig.delegated(
                "fair-scheduler.xml", "", PolicyServiceFixtures.Placing.class.getName()));

        assertInstanceOf(DelegatedPolicyEngine.class, engine);
        assertEquals(PolicyMode.DELEGATED, engine.mode());
        assertEquals("root.alice", engine.resolveRequestPool("", "alice").resolvedPool());
    }

    @Test
    @DisplayName("Delegated mode ignores the default pool memory limit")
    void shouldNotParseMemLimitWhenDelegated() {
        ResolverConfig config = new ResolverConfig("fair-scheduler.xml", "llama-site.xml", 10, "lots", 5,
                PolicyServiceFixtures.Placing.class.getName());

        assertEquals(PolicyMode.DELEGATED, create(config).mode());
    }

    @Test
    @DisplayName("Llama site without an allocation file fails startup")
    void shouldFailForLlamaSiteOnly() {
        ResolverConfig config = ResolverConfig.delegated(
                "", "llama-site.xml", PolicyServiceFixtures.Placing.class.getName());

        assertThrows(ConfigurationException.class, () -> create(config));
    }

    @Test
    @DisplayName("Binding failure fails startup")
    void shouldFailForBindingFailure() {
        ResolverConfig config = ResolverConfig.delegated(
                "fair-scheduler.xml", "", PolicyServiceFixtures.MissingConfigMethod.class.getName());

        assertThrows(ConfigurationException.class, () -> create(config));
    }

    private PolicyEngine create(ResolverConfig config) {
        return PolicyEngineFactory.create(config, classLoader, memSpecParser);
    }
}
