package com.usermanagement.exception;

/**
 * Exception thrown when a request carries no valid bearer token
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }
}
