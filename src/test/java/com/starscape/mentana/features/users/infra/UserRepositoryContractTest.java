package com.starscape.mentana.features.users.infra;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.ErrorKind;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link UserRepository} adapter must share.
 * Subclasses supply a fresh, empty repository per test.
 */
abstract class UserRepositoryContractTest {

    protected UserRepository repository;

    protected abstract UserRepository createRepository();

    @BeforeEach
    void setUpRepository() {
        repository = createRepository();
    }

    @Test
    void createThenFindReturnsEqualUser() {
        User user = newUser("grace@example.com", "Grace");

        assertTrue(repository.create(user).isSuccess());
        User found = repository.findById(user.getId()).value();

        assertEquals(user, found);
        assertEquals(user.getEmail(), found.getEmail());
        assertEquals(user.getName(), found.getName());
        assertEquals(user.isActive(), found.isActive());
        assertEquals(user.getCreatedAt(), found.getCreatedAt());
    }

    @Test
    void duplicateEmailIsConflict() {
        repository.create(newUser("dup@example.com", "First")).orElseThrow();

        Result<User> second = repository.create(newUser("dup@example.com", "Second"));

        assertTrue(second.isFailure());
        assertEquals(ErrorKind.CONFLICT, second.error().kind());
        assertEquals(1, repository.findAll().value().size());
    }

    @Test
    void unknownIdIsNotFound() {
        Result<User> result = repository.findById(UUID.randomUUID());

        assertTrue(result.isFailure());
        assertEquals(ErrorKind.NOT_FOUND, result.error().kind());
    }

    @Test
    void emptyStoreListsNothing() {
        assertEquals(List.of(), repository.findAll().value());
        assertEquals(List.of(), repository.findActive().value());
    }

    @Test
    void findActiveSkipsDeactivatedUsers() {
        User active = newUser("on@example.com", "On");
        User inactive = newUser("off@example.com", "Off");
        repository.create(active).orElseThrow();
        repository.create(inactive).orElseThrow();

        inactive.deactivate();
        repository.update(inactive).orElseThrow();

        List<User> result = repository.findActive().value();
        assertEquals(List.of(active), result);
        assertEquals(2, repository.findAll().value().size());
    }

    @Test
    void findByEmailResolvesTheOwner() {
        User user = newUser("owner@example.com", "Owner");
        repository.create(user).orElseThrow();

        assertEquals(user, repository.findByEmail("owner@example.com").value());
        assertEquals(ErrorKind.NOT_FOUND, repository.findByEmail("nobody@example.com").error().kind());
    }

    @Test
    void findByEmailMatchesTheAddressAsRegistered() {
        User user = newUser("Ada@Example.com", "Ada");
        repository.create(user).orElseThrow();

        assertEquals(user, repository.findByEmail("Ada@Example.com").value());
        assertEquals(user, repository.findByEmail("  ADA@example.COM ").value());
    }

    @Test
    void updatePersistsNameAndFlag() {
        User user = newUser("upd@example.com", "Before");
        repository.create(user).orElseThrow();

        user.rename("After").orElseThrow();
        user.deactivate();
        User updated = repository.update(user).value();

        assertEquals("After", updated.getName());
        assertFalse(updated.isActive());
        User reloaded = repository.findById(user.getId()).value();
        assertEquals("After", reloaded.getName());
        assertFalse(reloaded.isActive());
    }

    @Test
    void updateOfMissingUserIsNotFound() {
        User ghost = newUser("ghost@example.com", "Ghost");

        assertEquals(ErrorKind.NOT_FOUND, repository.update(ghost).error().kind());
    }

    @Test
    void deleteReleasesTheEmail() {
        User user = newUser("gone@example.com", "Gone");
        repository.create(user).orElseThrow();

        assertEquals(user, repository.delete(user.getId()).value());

        assertEquals(ErrorKind.NOT_FOUND, repository.findById(user.getId()).error().kind());
        assertEquals(ErrorKind.NOT_FOUND, repository.delete(user.getId()).error().kind());
        assertTrue(repository.create(newUser("gone@example.com", "Again")).isSuccess());
    }

    @Test
    void probeReportsReachable() {
        assertTrue(repository.probe().reachable());
    }

    protected static User newUser(String email, String name) {
        return User.create(email, name).value();
    }
}
