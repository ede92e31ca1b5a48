package com.requestpool;

import com.requestpool.exception.ConfigurationException;
import com.requestpool.exception.PolicyServiceException;
import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolResult;
import com.requestpool.resolver.PoolResolver;
import com.requestpool.spring.EnableRequestPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Resolves one request's pool and prints the pool's limits.
 * <p>
 * Usage: {@code --pool=<requested pool> --user=<user>} plus any {@code request-pool.*} property.
 */
@SpringBootApplication
@EnableRequestPool
public class RequestPoolApplication {

    private static final Logger log = LoggerFactory.getLogger(RequestPoolApplication.class);

    public static void main(String[] args) {
        try {
            SpringApplication.run(RequestPoolApplication.class, args);
        } catch (RuntimeException e) {
            ConfigurationException configError = findConfigurationError(e);
            if (configError == null) {
                throw e;
            }
            log.error("Unable to start request pool resolver: {}", configError.getMessage(), configError);
            System.exit(1);
        }
    }

    @Bean
    public ApplicationRunner resolve(PoolResolver resolver) {
        return args -> {
            String pool = optionValue(args, "pool", "default");
            String user = optionValue(args, "user", System.getProperty("user.name"));

            try {
                ResolveRequestPoolResult resolved = resolver.resolveRequestPool(pool, user);
                log.info("Pool '{}' for user {} resolved to '{}' (access {})",
                        pool, user, resolved.resolvedPool(), resolved.hasAccess() ? "granted" : "denied");

                PoolConfigResult config = resolver.getPoolConfig(resolved.resolvedPool());
                log.info("Pool '{}': max-requests={}, max-queued={}, mem-limit={}",
                        resolved.resolvedPool(), config.maxRequests(), config.maxQueued(), config.memLimit());
            } catch (PolicyServiceException e) {
                log.error("Lookup failed for pool '{}' and user {}: {}", pool, user, e.getMessage());
            }
        };
    }

    private static String optionValue(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    static ConfigurationException findConfigurationError(Throwable t) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConfigurationException configError) {
                return configError;
            }
        }
        return null;
    }
}
