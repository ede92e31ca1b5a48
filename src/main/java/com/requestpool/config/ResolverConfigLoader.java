package com.requestpool.config;

import com.requestpool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads resolver configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * request-pool:
 *   fair-scheduler-allocation-path: /etc/impala/fair-scheduler.xml
 *   llama-site-path: /etc/impala/llama-site.xml
 *   policy-service-class: com.cloudera.impala.util.RequestPoolUtils
 *   default-pool:
 *     max-requests: 20
 *     mem-limit: 10G
 *     max-queued: 50
 * </pre>
 */
public class ResolverConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ResolverConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ResolverConfig load(String path) {
        log.info("Loading request pool configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static ResolverConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(loaded, "<root>");

        // Section may sit at the root or under 'request-pool'
        Map<String, Object> section = root.containsKey("request-pool")
                ? getMap(root, "request-pool")
                : root;
        Map<String, Object> defaultPool = getMap(section, "default-pool");

        ResolverConfig config = new ResolverConfig(
                getString(section, "fair-scheduler-allocation-path", ""),
                getString(section, "llama-site-path", ""),
                getLong(defaultPool, "max-requests", ResolverConfig.DEFAULT_MAX_REQUESTS),
                getString(defaultPool, "mem-limit", ResolverConfig.DEFAULT_MEM_LIMIT),
                getLong(defaultPool, "max-queued", ResolverConfig.DEFAULT_MAX_QUEUED),
                getString(section, "policy-service-class", ResolverConfig.DEFAULT_POLICY_SERVICE_CLASS)
        );

        if (config.defaultPoolOnly()) {
            log.info("Loaded request pool configuration: default pool only, max-requests={}, mem-limit='{}', max-queued={}",
                    config.defaultPoolMaxRequests(), config.defaultPoolMemLimit(), config.defaultPoolMaxQueued());
        } else {
            log.info("Loaded request pool configuration: allocation={}, llama-site={}, policy-service={}",
                    config.fairSchedulerAllocationPath(), config.llamaSitePath(), config.policyServiceClass());
        }
        return config;
    }

    // Helper methods

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? Map.of() : asMap(value, key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a mapping for '" + key + "' but found: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer || value instanceof Long) return ((Number) value).longValue();
        // Doubles and out-of-range BigIntegers
        if (value instanceof Number) {
            throw new ConfigurationException("Expected an integer for '" + key + "' but found: " + value);
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "' but found: " + value, e);
        }
    }
}
