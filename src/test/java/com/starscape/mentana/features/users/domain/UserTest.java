package com.starscape.mentana.features.users.domain;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserTest {

    @Test
    void createNormalizesEmailAndStartsActive() {
        User user = User.create("  Ada.Lovelace@Example.COM ", "  Ada  ").value();

        assertEquals("ada.lovelace@example.com", user.getEmail());
        assertEquals("Ada", user.getName());
        assertTrue(user.isActive());
        assertNotNull(user.getId());
        assertEquals(user.getCreatedAt(), user.getUpdatedAt());
    }

    @Test
    void eachUserGetsItsOwnId() {
        User first = User.create("a@example.com", "A").value();
        User second = User.create("a@example.com", "A").value();

        assertNotEquals(first.getId(), second.getId());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "no-at-sign", "a@b", "a@b.c", "two@@example.com"})
    void rejectsInvalidEmail(String email) {
        Result<User> result = User.create(email, "Name");

        assertTrue(result.isFailure());
        assertEquals(ErrorKind.VALIDATION, result.error().kind());
    }

    @Test
    void rejectsBlankOrOverlongName() {
        assertEquals(ErrorKind.VALIDATION, User.create("a@example.com", " ").error().kind());
        assertEquals(ErrorKind.VALIDATION,
                User.create("a@example.com", "x".repeat(User.MAX_NAME_LENGTH + 1)).error().kind());
        assertTrue(User.create("a@example.com", "x".repeat(User.MAX_NAME_LENGTH)).isSuccess());
    }

    @Test
    void parseIdRejectsMalformedIds() {
        UUID id = UUID.randomUUID();

        assertEquals(id, User.parseId(id.toString()).value());
        assertEquals(ErrorKind.VALIDATION, User.parseId("not-a-uuid").error().kind());
        assertEquals(ErrorKind.VALIDATION, User.parseId(null).error().kind());
    }

    @Test
    void renameAndDeactivateTouchUpdatedAt() throws InterruptedException {
        User user = User.create("a@example.com", "Old").value();
        Thread.sleep(5);

        assertTrue(user.rename("New").isSuccess());
        user.deactivate();

        assertEquals("New", user.getName());
        assertFalse(user.isActive());
        assertTrue(user.getUpdatedAt().isAfter(user.getCreatedAt()));
        assertTrue(user.rename("").isFailure());
        assertEquals("New", user.getName());
    }

    @Test
    void copyIsEqualButIndependent() {
        User user = User.create("a@example.com", "Name").value();
        User copy = user.copy();

        copy.deactivate();

        assertEquals(user, copy);
        assertTrue(user.isActive());
    }
}
