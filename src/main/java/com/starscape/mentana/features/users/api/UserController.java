package com.starscape.mentana.features.users.api;

import com.starscape.mentana.features.users.api.dto.CreateUserRequest;
import com.starscape.mentana.features.users.api.dto.UpdateUserRequest;
import com.starscape.mentana.features.users.api.dto.UserListResponse;
import com.starscape.mentana.features.users.api.dto.UserResponse;
import com.starscape.mentana.features.users.app.CreateUserHandler;
import com.starscape.mentana.features.users.app.DeleteUserHandler;
import com.starscape.mentana.features.users.app.GetUserHandler;
import com.starscape.mentana.features.users.app.ListUsersHandler;
import com.starscape.mentana.features.users.app.UpdateUserHandler;
import com.starscape.mentana.features.users.domain.User;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * User CRUD endpoints. Failures from the handlers surface as {@code DomainException}
 * and are mapped by the global exception handler.
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final CreateUserHandler createUserHandler;
    private final GetUserHandler getUserHandler;
    private final ListUsersHandler listUsersHandler;
    private final UpdateUserHandler updateUserHandler;
    private final DeleteUserHandler deleteUserHandler;

    public UserController(
            CreateUserHandler createUserHandler,
            GetUserHandler getUserHandler,
            ListUsersHandler listUsersHandler,
            UpdateUserHandler updateUserHandler,
            DeleteUserHandler deleteUserHandler) {
        this.createUserHandler = createUserHandler;
        this.getUserHandler = getUserHandler;
        this.listUsersHandler = listUsersHandler;
        this.updateUserHandler = updateUserHandler;
        this.deleteUserHandler = deleteUserHandler;
    }

    /**
     * POST /users
     */
    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        User user = createUserHandler.handle(request.email(), request.name()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * GET /users/{userId}
     */
    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable String userId) {
        User user = getUserHandler.handle(userId).orElseThrow();
        return ResponseEntity.ok(UserResponse.from(user));
    }

    /**
     * List all users, or only active ones with {@code ?active=true}.
     * GET /users
     */
    @GetMapping
    public ResponseEntity<UserListResponse> listUsers(
            @RequestParam(name = "active", defaultValue = "false") boolean activeOnly) {
        List<UserResponse> users = listUsersHandler.handle(activeOnly).orElseThrow().stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(UserListResponse.of(users));
    }

    /**
     * PATCH /users/{userId}
     */
    @PatchMapping("/{userId}")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable String userId,
            @Valid @RequestBody UpdateUserRequest request) {
        User user = updateUserHandler.handle(userId, request.name(), request.active()).orElseThrow();
        return ResponseEntity.ok(UserResponse.from(user));
    }

    /**
     * DELETE /users/{userId}
     */
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deleteUser(@PathVariable String userId) {
        deleteUserHandler.handle(userId).orElseThrow();
        return ResponseEntity.noContent().build();
    }
}
