package com.requestpool.exception;

/**
 * Base exception for the request pool resolver.
 */
public class PoolResolverException extends RuntimeException {

    public PoolResolverException(String message) {
        super(message);
    }

    public PoolResolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
