package com.starscape.mentana.features.users.infra;

import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryUserRepositoryTest extends UserRepositoryContractTest {

    @Override
    protected UserRepository createRepository() {
        return new InMemoryUserRepository();
    }

    @Test
    void storedEntitiesAreIsolatedFromCallers() {
        User user = newUser("iso@example.com", "Iso");
        repository.create(user).orElseThrow();

        user.deactivate();
        repository.findById(user.getId()).value().rename("Changed");

        User stored = repository.findById(user.getId()).value();
        assertTrue(stored.isActive());
        assertEquals("Iso", stored.getName());
    }
}
