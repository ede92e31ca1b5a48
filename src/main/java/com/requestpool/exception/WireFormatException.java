package com.requestpool.exception;

/**
 * Exception thrown when a request or response cannot be serialized for the policy service.
 */
public class WireFormatException extends PolicyServiceException {

    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
