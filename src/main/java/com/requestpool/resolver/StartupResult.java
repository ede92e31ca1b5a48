package com.requestpool.resolver;

import com.requestpool.exception.ConfigurationException;

import java.util.Objects;

/**
 * Outcome of the resolver startup sequence: a started resolver or the configuration error that
 * prevented it. The process entry point decides what a failure means, typically log and exit.
 */
public final class StartupResult {

    private final PoolResolver resolver;
    private final ConfigurationException error;

    private StartupResult(PoolResolver resolver, ConfigurationException error) {
        this.resolver = resolver;
        this.error = error;
    }

    public static StartupResult succeeded(PoolResolver resolver) {
        return new StartupResult(Objects.requireNonNull(resolver, "resolver"), null);
    }

    public static StartupResult failed(ConfigurationException error) {
        return new StartupResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return resolver != null;
    }

    /**
     * Get the started resolver.
     *
     * @throws ConfigurationException the startup error if startup failed
     */
    public PoolResolver resolver() {
        if (error != null) {
            throw error;
        }
        return resolver;
    }

    /**
     * Get the startup error, or null if startup succeeded.
     */
    public ConfigurationException error() {
        return error;
    }
}
