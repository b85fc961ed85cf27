package com.forecast.sync.delta;

import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory repository. Rows are immutable and swapped whole, so lock-free readers always see a
 * complete row; writers serialize on the repository monitor.
 */
public class InMemoryModificationRepository implements ModificationRepository {

    private static final Comparator<Modification> NEWEST_FIRST =
            Comparator.comparing(Modification::getUpdatedAt).reversed().thenComparing(Modification::getId);
    private static final Comparator<Modification> OLDEST_COMMIT_FIRST =
            Comparator.comparing(Modification::getCommittedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(Modification::getId);

    private final ConcurrentMap<String, Modification> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<Modification> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public Optional<Modification> findActive(String mirrorId, String userId) {
        return rows.values().stream()
                .filter(m -> m.isActive() && m.getMirrorId().equals(mirrorId) && m.getUserId().equals(userId))
                .findFirst();
    }

    @Override
    public Map<String, Modification> findActiveByMirrors(Collection<String> mirrorIds, String userId) {
        Set<String> wanted = new HashSet<>(mirrorIds);
        Map<String, Modification> active = new HashMap<>();
        for (Modification m : rows.values()) {
            if (!m.isActive() || !wanted.contains(m.getMirrorId())) {
                continue;
            }
            if (userId != null && !userId.equals(m.getUserId())) {
                continue;
            }
            active.merge(m.getMirrorId(), m, (a, b) -> NEWEST_FIRST.compare(a, b) <= 0 ? a : b);
        }
        return active;
    }

    @Override
    public synchronized Modification insert(Modification modification) {
        if (modification.isActive()
                && findActive(modification.getMirrorId(), modification.getUserId()).isPresent()) {
            throw new IllegalStateException("An active modification already exists for mirror "
                    + modification.getMirrorId() + " and user " + modification.getUserId());
        }
        if (rows.putIfAbsent(modification.getId(), modification) != null) {
            throw new IllegalStateException("Modification already exists: " + modification.getId());
        }
        return modification;
    }

    @Override
    public synchronized boolean compareAndSet(Modification expected, Modification updated) {
        Modification current = rows.get(expected.getId());
        if (current == null
                || current.getSyncState() != expected.getSyncState()
                || current.getEditCount() != expected.getEditCount()
                || current.getAttemptCount() != expected.getAttemptCount()) {
            return false;
        }
        rows.put(updated.getId(), updated);
        return true;
    }

    @Override
    public List<Modification> findDrafts(DraftSelector selector) {
        return rows.values().stream().filter(selector::matches).sorted(NEWEST_FIRST).toList();
    }

    @Override
    public synchronized int commitDrafts(DraftSelector selector, Instant committedAt) {
        int committed = 0;
        for (Modification m : new ArrayList<>(rows.values())) {
            if (selector.matches(m)) {
                rows.put(m.getId(), m.toBuilder()
                        .syncState(SyncState.COMMITTED)
                        .committedAt(committedAt)
                        .updatedAt(committedAt)
                        .build());
                committed++;
            }
        }
        return committed;
    }

    @Override
    public synchronized int deleteDrafts(DraftSelector selector) {
        int deleted = 0;
        for (Modification m : new ArrayList<>(rows.values())) {
            if (selector.matches(m) && rows.remove(m.getId(), m)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long countDrafts(String organizationId, String userId) {
        DraftSelector selector = DraftSelector.allDrafts(organizationId, userId);
        return rows.values().stream().filter(selector::matches).count();
    }

    @Override
    public List<Modification> findByEntity(String organizationId, String entityId) {
        return rows.values().stream()
                .filter(m -> m.getOrganizationId().equals(organizationId) && m.getEntityId().equals(entityId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public synchronized List<Modification> claimDue(int limit, Instant now) {
        List<Modification> due = rows.values().stream()
                .filter(m -> m.isDueAt(now))
                .sorted(OLDEST_COMMIT_FIRST)
                .limit(limit)
                .toList();
        List<Modification> claimed = new ArrayList<>(due.size());
        for (Modification m : due) {
            Modification syncing = m.toBuilder().syncState(SyncState.SYNCING).updatedAt(now).build();
            rows.put(syncing.getId(), syncing);
            claimed.add(syncing);
        }
        return claimed;
    }

    @Override
    public List<Modification> findByState(String organizationId, SyncState state) {
        return rows.values().stream()
                .filter(m -> m.getSyncState() == state && m.getOrganizationId().equals(organizationId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Map<SyncState, Long> countByState(String organizationId) {
        Map<SyncState, Long> counts = new EnumMap<>(SyncState.class);
        for (SyncState state : SyncState.values()) {
            counts.put(state, 0L);
        }
        rows.values().stream()
                .filter(m -> m.getOrganizationId().equals(organizationId))
                .forEach(m -> counts.merge(m.getSyncState(), 1L, Long::sum));
        return counts;
    }

    @Override
    public synchronized boolean delete(String id) {
        return rows.remove(id) != null;
    }

    public int size() {
        return rows.size();
    }
}
