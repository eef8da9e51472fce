package com.usermanagement.exception;

/**
 * Base class for expected failures that map to a client error response
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }
}
