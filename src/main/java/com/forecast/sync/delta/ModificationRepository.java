package com.forecast.sync.delta;

import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for {@link Modification} rows. At most one active row (draft, committed or
 * syncing) exists per (mirror, user) pair.
 */
public interface ModificationRepository {

    Optional<Modification> findById(String id);

    /**
     * The active row of the (mirror, user) pair, if any.
     */
    Optional<Modification> findActive(String mirrorId, String userId);

    /**
     * Active rows for the given mirrors keyed by mirror id. With a null {@code userId} the most
     * recently updated active row of each mirror is returned.
     */
    Map<String, Modification> findActiveByMirrors(Collection<String> mirrorIds, String userId);

    /**
     * Stores a new row.
     *
     * @throws IllegalStateException if the row is active and its pair already has an active row
     */
    Modification insert(Modification modification);

    /**
     * Replaces {@code expected} with {@code updated} only if the stored row still has the
     * expected state, edit count and attempt count.
     *
     * @return true if the row was replaced
     */
    boolean compareAndSet(Modification expected, Modification updated);

    List<Modification> findDrafts(DraftSelector selector);

    /**
     * Moves matching drafts to committed in one step.
     *
     * @return number of rows transitioned
     */
    int commitDrafts(DraftSelector selector, Instant committedAt);

    /**
     * Deletes matching drafts.
     *
     * @return number of rows deleted
     */
    int deleteDrafts(DraftSelector selector);

    long countDrafts(String organizationId, String userId);

    /**
     * Every row of the entity, most recently updated first.
     */
    List<Modification> findByEntity(String organizationId, String entityId);

    /**
     * Atomically moves up to {@code limit} due committed rows to syncing, oldest commit first.
     * A row is returned by at most one concurrent caller.
     */
    List<Modification> claimDue(int limit, Instant now);

    List<Modification> findByState(String organizationId, SyncState state);

    Map<SyncState, Long> countByState(String organizationId);

    boolean delete(String id);
}
