package com.starscape.mentana.features.users.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Changes a user's name and/or active flag. Null arguments leave the field as it is.
 */
@Service
public class UpdateUserHandler {

    static final String OPERATION = "updateUser";

    private static final Logger log = LoggerFactory.getLogger(UpdateUserHandler.class);

    private final UserRepository userRepository;

    public UpdateUserHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Result<User> handle(String userId, String name, Boolean active) {
        Result<User> result = User.parseId(userId)
                .flatMap(userRepository::findById)
                .flatMap(user -> apply(user, name, active))
                .flatMap(userRepository::update)
                .withOperation(OPERATION);
        if (result.isSuccess()) {
            log.info("User updated: userId={}", userId);
        }
        return result;
    }

    private Result<User> apply(User user, String name, Boolean active) {
        if (name != null) {
            Result<User> renamed = user.rename(name);
            if (renamed.isFailure()) {
                return renamed;
            }
        }
        if (Boolean.TRUE.equals(active) && !user.isActive()) {
            user.activate();
        } else if (Boolean.FALSE.equals(active) && user.isActive()) {
            user.deactivate();
        }
        return Result.success(user);
    }
}
