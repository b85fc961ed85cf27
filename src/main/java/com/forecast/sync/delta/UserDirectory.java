package com.forecast.sync.delta;

import com.forecast.sync.core.model.UserIdentity;

import java.util.Optional;

/**
 * Looks up authoring identities for modification history. Identity management itself lives
 * outside the sync engine.
 */
@FunctionalInterface
public interface UserDirectory {

    Optional<UserIdentity> findUser(String userId);

    /**
     * A directory that knows nobody; history shows bare user ids.
     */
    static UserDirectory anonymous() {
        return userId -> Optional.empty();
    }
}
