package com.starscape.mentana.features.users.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers a new user. Input validation happens in {@link User#create}; email uniqueness is
 * left to the repository, which answers CONFLICT.
 */
@Service
public class CreateUserHandler {

    static final String OPERATION = "createUser";

    private static final Logger log = LoggerFactory.getLogger(CreateUserHandler.class);

    private final UserRepository userRepository;

    public CreateUserHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Result<User> handle(String email, String name) {
        log.debug("Creating user with email {}", email);
        Result<User> result = User.create(email, name)
                .flatMap(userRepository::create)
                .withOperation(OPERATION);
        if (result.isSuccess()) {
            log.info("User created successfully: userId={}", result.value().getId());
        }
        return result;
    }
}
