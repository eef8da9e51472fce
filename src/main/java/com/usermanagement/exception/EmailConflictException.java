package com.usermanagement.exception;

import lombok.Getter;

/**
 * Thrown when a write would give two users the same email
 */
@Getter
public class EmailConflictException extends BusinessException {

    private final String email;

    private EmailConflictException(String email, String message) {
        super(message);
        this.email = email;
    }

    public static EmailConflictException onCreate(String email) {
        return new EmailConflictException(email, "A user with email '" + email + "' already exists.");
    }

    public static EmailConflictException onUpdate(String email) {
        return new EmailConflictException(email, "A different user already uses email '" + email + "'.");
    }
}
