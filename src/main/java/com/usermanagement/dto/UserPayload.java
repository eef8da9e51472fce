package com.usermanagement.dto;

/**
 * Editable user fields shared by create and update requests
 */
public interface UserPayload {

    String getEmail();

    String getFullName();

    default String normalizedEmail() {
        return getEmail().trim();
    }

    default String normalizedFullName() {
        return getFullName().trim();
    }

    static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
