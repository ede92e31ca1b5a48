package com.requestpool.exception;

/**
 * Exception thrown when a single resolve or config lookup fails in delegated mode.
 * Scoped to the request; the resolver stays usable.
 */
public class PolicyServiceException extends PoolResolverException {

    public PolicyServiceException(String message) {
        super(message);
    }

    public PolicyServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
