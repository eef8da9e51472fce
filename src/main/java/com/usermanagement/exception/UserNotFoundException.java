package com.usermanagement.exception;

/**
 * User not found exception
 */
public class UserNotFoundException extends BusinessException {
    public UserNotFoundException(Object id) {
        super("User with id '" + id + "' was not found.");
    }
}
