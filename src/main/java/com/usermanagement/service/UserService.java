package com.usermanagement.service;

import com.usermanagement.domain.User;
import com.usermanagement.dto.CreateUserRequest;
import com.usermanagement.dto.UpdateUserRequest;
import com.usermanagement.exception.EmailConflictException;
import com.usermanagement.exception.UserNotFoundException;
import com.usermanagement.repository.UserRepository;
import com.usermanagement.repository.UserWriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * User management service
 */
@Service
@Slf4j
public class UserService {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private Clock clock;

    /**
     * All users ordered by full name, then email
     */
    public List<User> listUsers() {
        List<User> users = userRepository.list();
        log.debug("Listed users: count={}", users.size());
        return users;
    }

    /**
     * Get user by ID
     */
    public User getUserById(UUID userId) {
        return userRepository.get(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    /**
     * Create a new user with a fresh id
     */
    public User createUser(CreateUserRequest request) {
        String email = request.normalizedEmail();

        // Fast rejection; the repository re-checks atomically on commit
        if (userRepository.emailExists(email, null)) {
            throw EmailConflictException.onCreate(email);
        }

        User user = User.builder()
                .id(UUID.randomUUID())
                .email(email)
                .fullName(request.normalizedFullName())
                .createdAt(clock.instant())
                .build();

        UserWriteResult result = userRepository.create(user);
        switch (result.getStatus()) {
            case OK:
                log.info("User created: userId={}, email={}", user.getId(), email);
                return result.getUser();
            case EMAIL_CONFLICT:
                throw EmailConflictException.onCreate(email);
            default:
                throw new IllegalStateException("Unexpected create outcome " + result.getStatus()
                        + " for generated id " + user.getId());
        }
    }

    /**
     * Replace the email and full name of an existing user
     */
    public User updateUser(UUID userId, UpdateUserRequest request) {
        String email = request.normalizedEmail();
        String fullName = request.normalizedFullName();

        if (userRepository.emailExists(email, userId)) {
            throw EmailConflictException.onUpdate(email);
        }

        UserWriteResult result = userRepository.update(userId, current -> current.toBuilder()
                .email(email)
                .fullName(fullName)
                .updatedAt(clock.instant())
                .build());

        switch (result.getStatus()) {
            case OK:
                log.info("User updated: userId={}", userId);
                return result.getUser();
            case NOT_FOUND:
                throw new UserNotFoundException(userId);
            case EMAIL_CONFLICT:
                throw EmailConflictException.onUpdate(email);
            default:
                throw new IllegalStateException("Unexpected update outcome " + result.getStatus()
                        + " for user " + userId);
        }
    }

    /**
     * Delete user
     */
    public void deleteUser(UUID userId) {
        if (!userRepository.delete(userId)) {
            throw new UserNotFoundException(userId);
        }
        log.info("User deleted: userId={}", userId);
    }
}
