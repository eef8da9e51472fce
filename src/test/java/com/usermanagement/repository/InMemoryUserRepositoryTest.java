package com.usermanagement.repository;

import com.usermanagement.domain.User;
import com.usermanagement.enums.WriteStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static com.usermanagement.testutil.UserTestBuilder.user;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InMemoryUserRepository
 */
@DisplayName("In-Memory User Repository Tests")
class InMemoryUserRepositoryTest {

    private InMemoryUserRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUserRepository();
    }

    @Test
    @DisplayName("Created user can be fetched by id")
    void testCreateThenGet() {
        User user = user().email("jane.doe@example.com").fullName("Jane Doe").build();

        UserWriteResult result = repository.create(user);

        assertThat(result.getStatus()).isEqualTo(WriteStatus.OK);
        assertThat(result.getUser()).isEqualTo(user);
        assertThat(repository.get(user.getId())).contains(user);
    }

    @Test
    @DisplayName("Get on unknown id is empty")
    void testGetUnknown() {
        assertThat(repository.get(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("Create with an existing id is rejected and keeps the original")
    void testCreateDuplicateId() {
        User original = user().email("first@example.com").build();
        repository.create(original);

        User clash = user().id(original.getId()).email("second@example.com").build();
        UserWriteResult result = repository.create(clash);

        assertThat(result.getStatus()).isEqualTo(WriteStatus.ALREADY_EXISTS);
        assertThat(result.getUser()).isNull();
        assertThat(repository.get(original.getId())).contains(original);
        assertThat(repository.emailExists("second@example.com", null)).isFalse();
    }

    @Test
    @DisplayName("Create with an email differing only in case is a conflict")
    void testCreateCaseInsensitiveEmailConflict() {
        repository.create(user().email("Jane.Doe@Example.com").build());

        UserWriteResult result = repository.create(user().email("jane.doe@example.COM").build());

        assertThat(result.getStatus()).isEqualTo(WriteStatus.EMAIL_CONFLICT);
        assertThat(repository.list()).hasSize(1);
    }

    @Test
    @DisplayName("List is sorted by full name then email, case-insensitive")
    void testListOrdering() {
        repository.create(user().fullName("bob Stone").email("b@example.com").build());
        repository.create(user().fullName("Alice Smith").email("z@example.com").build());
        repository.create(user().fullName("alice smith").email("A@example.com").build());
        repository.create(user().fullName("Carol Jones").email("c@example.com").build());

        List<User> users = repository.list();

        assertThat(users).extracting(User::getEmail)
                .containsExactly("A@example.com", "z@example.com", "b@example.com", "c@example.com");
    }

    @Test
    @DisplayName("List returns a snapshot unaffected by later writes")
    void testListSnapshot() {
        User user = user().build();
        repository.create(user);

        List<User> snapshot = repository.list();
        repository.delete(user.getId());
        repository.create(user().email("other@example.com").build());

        assertThat(snapshot).containsExactly(user);
    }

    @Test
    @DisplayName("Update applies the transform and returns the committed record")
    void testUpdate() {
        User user = user().fullName("A B").build();
        repository.create(user);
        Instant updatedAt = Instant.parse("2024-02-01T00:00:00Z");

        UserWriteResult result = repository.update(user.getId(),
                current -> current.toBuilder().fullName("C D").updatedAt(updatedAt).build());

        assertThat(result.getStatus()).isEqualTo(WriteStatus.OK);
        assertThat(result.getUser().getFullName()).isEqualTo("C D");
        assertThat(result.getUser().getUpdatedAt()).isEqualTo(updatedAt);
        assertThat(result.getUser().getCreatedAt()).isEqualTo(user.getCreatedAt());
        assertThat(repository.get(user.getId())).contains(result.getUser());
    }

    @Test
    @DisplayName("Update on unknown id reports not found and creates nothing")
    void testUpdateUnknown() {
        UUID id = UUID.randomUUID();

        UserWriteResult result = repository.update(id, current -> current.toBuilder().fullName("X Y").build());

        assertThat(result.getStatus()).isEqualTo(WriteStatus.NOT_FOUND);
        assertThat(repository.get(id)).isEmpty();
        assertThat(repository.list()).isEmpty();
    }

    @Test
    @DisplayName("Update moving onto another user's email is a conflict")
    void testUpdateEmailConflict() {
        User jane = user().email("jane@example.com").build();
        User john = user().email("john@example.com").build();
        repository.create(jane);
        repository.create(john);

        UserWriteResult result = repository.update(john.getId(),
                current -> current.toBuilder().email("JANE@example.com").build());

        assertThat(result.getStatus()).isEqualTo(WriteStatus.EMAIL_CONFLICT);
        assertThat(repository.get(john.getId())).contains(john);
    }

    @Test
    @DisplayName("Email released by an update can be taken by another user")
    void testEmailReleasedAfterUpdate() {
        User jane = user().email("jane@example.com").build();
        repository.create(jane);

        repository.update(jane.getId(), current -> current.toBuilder().email("jane.new@example.com").build());

        assertThat(repository.emailExists("jane@example.com", null)).isFalse();
        assertThat(repository.emailExists("jane.new@example.com", null)).isTrue();
        assertThat(repository.create(user().email("jane@example.com").build()).isOk()).isTrue();
    }

    @Test
    @DisplayName("Update changing only the email case keeps ownership")
    void testUpdateEmailCaseOnly() {
        User jane = user().email("jane@example.com").build();
        repository.create(jane);

        UserWriteResult result = repository.update(jane.getId(),
                current -> current.toBuilder().email("Jane@Example.com").build());

        assertThat(result.isOk()).isTrue();
        assertThat(repository.emailExists("jane@example.com", null)).isTrue();
        assertThat(repository.emailExists("jane@example.com", jane.getId())).isFalse();
    }

    @Test
    @DisplayName("Transform changing the id is rejected")
    void testUpdateRejectsIdChange() {
        User user = user().build();
        repository.create(user);

        assertThatThrownBy(() -> repository.update(user.getId(),
                current -> current.toBuilder().id(UUID.randomUUID()).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Update on an interrupted thread is cancelled")
    void testUpdateCancelledByInterrupt() {
        User user = user().build();
        repository.create(user);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> repository.update(user.getId(), current -> current))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(repository.get(user.getId())).contains(user);
    }

    @Test
    @DisplayName("Delete removes once; get afterwards is empty")
    void testDelete() {
        User user = user().build();
        repository.create(user);

        assertThat(repository.delete(user.getId())).isTrue();
        assertThat(repository.delete(user.getId())).isFalse();
        assertThat(repository.get(user.getId())).isEmpty();
        assertThat(repository.emailExists(user.getEmail(), null)).isFalse();
    }

    @Test
    @DisplayName("Email exists is case-insensitive, honours the exclusion and ignores blanks")
    void testEmailExists() {
        User jane = user().email("jane@example.com").build();
        repository.create(jane);

        assertThat(repository.emailExists("JANE@EXAMPLE.COM", null)).isTrue();
        assertThat(repository.emailExists(" jane@example.com ", null)).isTrue();
        assertThat(repository.emailExists("jane@example.com", UUID.randomUUID())).isTrue();
        assertThat(repository.emailExists("jane@example.com", jane.getId())).isFalse();
        assertThat(repository.emailExists("john@example.com", null)).isFalse();
        assertThat(repository.emailExists("", null)).isFalse();
        assertThat(repository.emailExists("   ", null)).isFalse();
        assertThat(repository.emailExists(null, null)).isFalse();
    }

    @Test
    @DisplayName("Null arguments are contract violations")
    void testNullArguments() {
        assertThatNullPointerException().isThrownBy(() -> repository.get(null));
        assertThatNullPointerException().isThrownBy(() -> repository.create(null));
        assertThatNullPointerException().isThrownBy(() -> repository.update(UUID.randomUUID(), null));
        assertThatNullPointerException().isThrownBy(() -> repository.delete(null));
    }
}
