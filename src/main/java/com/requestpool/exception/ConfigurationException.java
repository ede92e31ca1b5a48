package com.requestpool.exception;

/**
 * Exception thrown when configuration is invalid or the policy service cannot be bound.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PoolResolverException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
