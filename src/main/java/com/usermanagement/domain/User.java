package com.usermanagement.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * User record held by the repository.
 * Immutable: every change produces a new instance through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class User {
    /**
     * Unique user identifier, fixed for the life of the record
     */
    @NonNull
    UUID id;

    /**
     * Email address (case-insensitively unique)
     */
    @NonNull
    String email;

    /**
     * Display name
     */
    @NonNull
    String fullName;

    /**
     * Creation time (UTC)
     */
    @NonNull
    Instant createdAt;

    /**
     * Last update time (UTC), null until the first update
     */
    Instant updatedAt;
}
