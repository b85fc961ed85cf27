package com.forecast.sync.core.model;

/**
 * Write-back state of a {@link Modification}.
 */
public enum SyncState {
    DRAFT("draft"),
    COMMITTED("committed"),
    SYNCING("syncing"),
    SYNC_ERROR("sync_error"),
    CONFLICT("conflict"),
    RETIRED("retired");

    private final String code;

    SyncState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Active states count against the one-delta-per-(mirror, user) rule and overlay merged views.
     */
    public boolean isActive() {
        return this == DRAFT || this == COMMITTED || this == SYNCING;
    }

    public static SyncState fromCode(String code) {
        for (SyncState state : values()) {
            if (state.code.equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown sync state: " + code);
    }
}
