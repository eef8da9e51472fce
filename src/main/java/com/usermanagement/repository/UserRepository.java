package com.usermanagement.repository;

import com.usermanagement.domain.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Storage abstraction for user records.
 * <p>
 * Implementations must be safe for concurrent use without external locking.
 * Outcomes such as a missing record or a duplicate email are reported through
 * return values; exceptions are reserved for contract violations such as null
 * arguments.
 */
public interface UserRepository {

    /**
     * All live users ordered by full name, then email, both case-insensitive.
     * The returned list is a snapshot owned by the caller.
     */
    List<User> list();

    /**
     * Number of live users
     */
    int count();

    /**
     * Find a user by id
     */
    Optional<User> get(UUID id);

    /**
     * Insert a new record keyed by {@code user.getId()}.
     *
     * @return {@code OK} with the stored record, {@code ALREADY_EXISTS} if the id is taken,
     *         or {@code EMAIL_CONFLICT} if another live user holds the same email
     */
    UserWriteResult create(User user);

    /**
     * Replace the record for {@code id} with {@code transform(current)}.
     * The replacement is committed only if the record is unchanged since it was read;
     * otherwise the read-transform-commit cycle is repeated. The transform may therefore
     * run more than once and must not have side effects.
     *
     * @return {@code OK} with the committed record, {@code NOT_FOUND} once the record is
     *         absent, or {@code EMAIL_CONFLICT} if the new email belongs to another live user
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
     *         while retrying
     */
    UserWriteResult update(UUID id, UnaryOperator<User> transform);

    /**
     * Remove the record for {@code id}.
     *
     * @return true if this call removed it
     */
    boolean delete(UUID id);

    /**
     * Whether a live user other than {@code excludeId} holds {@code email}, compared
     * case-insensitively. Blank emails never exist.
     *
     * @param excludeId id to ignore, may be null
     */
    boolean emailExists(String email, UUID excludeId);
}
