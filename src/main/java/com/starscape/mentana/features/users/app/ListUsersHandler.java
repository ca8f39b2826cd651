package com.starscape.mentana.features.users.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Lists users. An empty store is an empty list, not a failure.
 */
@Service
public class ListUsersHandler {

    static final String OPERATION = "listUsers";

    private static final Logger log = LoggerFactory.getLogger(ListUsersHandler.class);

    private final UserRepository userRepository;

    public ListUsersHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Result<List<User>> handle(boolean activeOnly) {
        Result<List<User>> result = activeOnly ? userRepository.findActive() : userRepository.findAll();
        if (result.isSuccess()) {
            log.debug("Listed {} users (activeOnly={})", result.value().size(), activeOnly);
        }
        return result.withOperation(OPERATION);
    }
}
