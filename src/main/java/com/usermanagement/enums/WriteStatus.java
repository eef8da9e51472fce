package com.usermanagement.enums;

/**
 * Outcome of a repository write
 */
public enum WriteStatus {
    /**
     * The write was committed
     */
    OK,

    /**
     * No live record with the given id
     */
    NOT_FOUND,

    /**
     * A record with the given id is already present
     */
    ALREADY_EXISTS,

    /**
     * Another live record already holds the email
     */
    EMAIL_CONFLICT
}
