package com.usermanagement.security;

/**
 * Checks bearer tokens presented by API clients
 */
public interface TokenValidator {

    /**
     * Whether at least one accepted token is configured.
     * When false every authenticated request is rejected.
     */
    boolean hasConfiguredTokens();

    /**
     * Whether the trimmed token exactly matches an accepted token
     */
    boolean isValid(String token);
}
