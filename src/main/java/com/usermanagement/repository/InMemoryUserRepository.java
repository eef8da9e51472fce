package com.usermanagement.repository;

import com.usermanagement.domain.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Thread-safe in-memory user store.
 * <p>
 * Records are immutable values held in a {@link ConcurrentHashMap}. Reads never block.
 * Updates use optimistic concurrency: read, transform, then compare-and-swap the full
 * record value, retrying on contention.
 * <p>
 * Email uniqueness is enforced at commit time through a secondary index from normalized
 * email to owning id. Any write that gives a record a new email commits inside the
 * index's per-key atomic section, so the uniqueness check and the commit cannot be
 * interleaved with another write claiming the same email. An index entry whose owner no
 * longer holds that email is stale and counts as free.
 */
@Slf4j
@Repository
public class InMemoryUserRepository implements UserRepository {

    private static final Comparator<User> DISPLAY_ORDER = Comparator
            .comparing(User::getFullName, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(User::getEmail, String.CASE_INSENSITIVE_ORDER);

    private final ConcurrentHashMap<UUID, User> users = new ConcurrentHashMap<>();

    /**
     * Normalized email -> id of the user holding it
     */
    private final ConcurrentHashMap<String, UUID> emailOwners = new ConcurrentHashMap<>();

    @Override
    public List<User> list() {
        List<User> snapshot = new ArrayList<>(users.values());
        snapshot.sort(DISPLAY_ORDER);
        return snapshot;
    }

    @Override
    public int count() {
        return users.size();
    }

    @Override
    public Optional<User> get(UUID id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public UserWriteResult create(User user) {
        Objects.requireNonNull(user, "user");
        UUID id = user.getId();
        AtomicReference<UserWriteResult> result = new AtomicReference<>();

        emailOwners.compute(normalize(user.getEmail()), (key, owner) -> {
            if (users.containsKey(id)) {
                result.set(UserWriteResult.alreadyExists());
                return owner;
            }
            if (isHeldByOther(owner, id, key)) {
                result.set(UserWriteResult.emailConflict());
                return owner;
            }
            if (users.putIfAbsent(id, user) != null) {
                result.set(UserWriteResult.alreadyExists());
                return owner;
            }
            result.set(UserWriteResult.ok(user));
            return id;
        });

        if (result.get().isOk()) {
            log.debug("Stored user: id={}", id);
        } else {
            log.debug("User not stored: id={}, status={}", id, result.get().getStatus());
        }
        return result.get();
    }

    @Override
    public UserWriteResult update(UUID id, UnaryOperator<User> transform) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(transform, "transform");

        int attempt = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Update of user " + id + " cancelled");
            }

            User current = users.get(id);
            if (current == null) {
                return UserWriteResult.notFound();
            }

            User candidate = Objects.requireNonNull(transform.apply(current), "transform result");
            if (!candidate.getId().equals(id)) {
                throw new IllegalArgumentException("Transform must not change the user id: " + id);
            }

            String currentKey = normalize(current.getEmail());
            String candidateKey = normalize(candidate.getEmail());

            if (currentKey.equals(candidateKey)) {
                if (users.replace(id, current, candidate)) {
                    return UserWriteResult.ok(candidate);
                }
            } else {
                UserWriteResult result = commitWithNewEmail(id, current, candidate, candidateKey);
                if (result != null) {
                    if (result.isOk()) {
                        release(currentKey);
                    }
                    return result;
                }
            }

            attempt++;
            log.debug("Concurrent modification of user {}, retrying (attempt {})", id, attempt);
        }
    }

    @Override
    public boolean delete(UUID id) {
        Objects.requireNonNull(id, "id");
        User removed = users.remove(id);
        if (removed == null) {
            return false;
        }
        release(normalize(removed.getEmail()));
        return true;
    }

    @Override
    public boolean emailExists(String email, UUID excludeId) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String key = normalize(email);
        UUID owner = emailOwners.get(key);
        return owner != null
                && !owner.equals(excludeId)
                && holdsEmail(users.get(owner), key);
    }

    /**
     * Claim {@code key} for {@code id} and swap in the candidate as one atomic step.
     *
     * @return the outcome, or null if the record changed since it was read
     */
    private UserWriteResult commitWithNewEmail(UUID id, User current, User candidate, String key) {
        AtomicReference<UserWriteResult> result = new AtomicReference<>();
        emailOwners.compute(key, (k, owner) -> {
            if (isHeldByOther(owner, id, k)) {
                result.set(UserWriteResult.emailConflict());
                return owner;
            }
            if (users.replace(id, current, candidate)) {
                result.set(UserWriteResult.ok(candidate));
                return id;
            }
            return owner;
        });
        return result.get();
    }

    /**
     * Drop the index entry for {@code key} unless its owner still holds that email.
     */
    private void release(String key) {
        emailOwners.computeIfPresent(key, (k, owner) -> holdsEmail(users.get(owner), k) ? owner : null);
    }

    private boolean isHeldByOther(UUID owner, UUID id, String key) {
        return owner != null && !owner.equals(id) && holdsEmail(users.get(owner), key);
    }

    private static boolean holdsEmail(User user, String key) {
        return user != null && normalize(user.getEmail()).equals(key);
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
