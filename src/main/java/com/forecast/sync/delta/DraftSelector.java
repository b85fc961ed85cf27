package com.forecast.sync.delta;

import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;

import java.util.Objects;
import java.util.Set;

/**
 * Selects a user's draft rows for bulk commit or discard.
 *
 * @param organizationId owning organization
 * @param userId         draft author
 * @param sessionId      restrict to drafts saved in this session, or null for any session
 * @param mirrorIds      restrict to these mirror rows, or null for all of the user's drafts
 */
public record DraftSelector(String organizationId, String userId, String sessionId, Set<String> mirrorIds) {

    public DraftSelector {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(userId, "userId is required");
        mirrorIds = mirrorIds != null ? Set.copyOf(mirrorIds) : null;
    }

    public static DraftSelector allDrafts(String organizationId, String userId) {
        return new DraftSelector(organizationId, userId, null, null);
    }

    public boolean matches(Modification modification) {
        return modification.getSyncState() == SyncState.DRAFT
                && modification.getOrganizationId().equals(organizationId)
                && modification.getUserId().equals(userId)
                && (sessionId == null || sessionId.equals(modification.getSessionId()))
                && (mirrorIds == null || mirrorIds.contains(modification.getMirrorId()));
    }
}
