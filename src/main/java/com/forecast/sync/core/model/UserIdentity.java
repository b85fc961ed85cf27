package com.forecast.sync.core.model;

import java.util.Objects;

/**
 * Authoring identity attached to modification history.
 */
public record UserIdentity(String userId, String username, String displayName) {

    public UserIdentity {
        Objects.requireNonNull(userId, "userId is required");
        username = username != null ? username : userId;
        displayName = displayName != null ? displayName : username;
    }

    public static UserIdentity unknown(String userId) {
        return new UserIdentity(userId, userId, userId);
    }
}
