package com.starscape.mentana.features.users.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.springframework.stereotype.Service;

@Service
public class GetUserHandler {

    static final String OPERATION = "getUser";

    private final UserRepository userRepository;

    public GetUserHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Result<User> handle(String userId) {
        return User.parseId(userId)
                .flatMap(userRepository::findById)
                .withOperation(OPERATION);
    }
}
