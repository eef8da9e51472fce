package com.usermanagement.repository;

import com.usermanagement.domain.User;
import com.usermanagement.enums.WriteStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a create or update against a {@link UserRepository}.
 * Carries the committed record when the status is {@link WriteStatus#OK}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserWriteResult {

    private static final UserWriteResult NOT_FOUND = new UserWriteResult(WriteStatus.NOT_FOUND, null);
    private static final UserWriteResult ALREADY_EXISTS = new UserWriteResult(WriteStatus.ALREADY_EXISTS, null);
    private static final UserWriteResult EMAIL_CONFLICT = new UserWriteResult(WriteStatus.EMAIL_CONFLICT, null);

    WriteStatus status;

    User user;

    public static UserWriteResult ok(User user) {
        return new UserWriteResult(WriteStatus.OK, user);
    }

    public static UserWriteResult notFound() {
        return NOT_FOUND;
    }

    public static UserWriteResult alreadyExists() {
        return ALREADY_EXISTS;
    }

    public static UserWriteResult emailConflict() {
        return EMAIL_CONFLICT;
    }

    public boolean isOk() {
        return status == WriteStatus.OK;
    }
}
