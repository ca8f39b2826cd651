package com.starscape.mentana.features.users.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DeleteUserHandler {

    static final String OPERATION = "deleteUser";

    private static final Logger log = LoggerFactory.getLogger(DeleteUserHandler.class);

    private final UserRepository userRepository;

    public DeleteUserHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Result<User> handle(String userId) {
        Result<User> result = User.parseId(userId)
                .flatMap(userRepository::delete)
                .withOperation(OPERATION);
        if (result.isSuccess()) {
            log.info("User deleted: userId={}", userId);
        }
        return result;
    }
}
