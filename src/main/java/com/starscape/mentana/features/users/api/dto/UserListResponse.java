package com.starscape.mentana.features.users.api.dto;

import java.util.List;

/**
 * Single-page listing; page is always 1 and size equals total.
 */
public record UserListResponse(
    List<UserResponse> users,
    int total,
    int page,
    int size
) {

    public static UserListResponse of(List<UserResponse> users) {
        return new UserListResponse(users, users.size(), 1, users.size());
    }
}
