package com.requestpool.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the request pool resolver.
 */
@ConfigurationProperties(prefix = "request-pool")
public class RequestPoolProperties {

    /**
     * Whether the resolver is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the resolver configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:request-pool.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
