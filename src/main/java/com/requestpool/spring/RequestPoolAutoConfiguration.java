package com.requestpool.spring;

import com.requestpool.config.ResolverConfig;
import com.requestpool.config.ResolverConfigLoader;
import com.requestpool.resolver.PoolResolver;
import com.requestpool.resolver.PoolResolverFactory;
import com.requestpool.resolver.StartupResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the request pool resolver.
 */
@Configuration
@ConditionalOnProperty(prefix = "request-pool", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RequestPoolProperties.class)
public class RequestPoolAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResolverConfig resolverConfig(RequestPoolProperties properties) {
        return ResolverConfigLoader.load(properties.getConfigPath());
    }

    /**
     * A failed startup fails the application context.
     */
    @Bean
    @ConditionalOnMissingBean
    public PoolResolver poolResolver(ResolverConfig config) {
        StartupResult result = PoolResolverFactory.create(config);
        return result.resolver();
    }
}
