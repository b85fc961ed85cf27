package com.forecast.sync.mirror;

import com.forecast.sync.api.PageRequest;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory mirror store. Rows are kept per organization in entity-id order so unfiltered counts
 * and paged reads do not need a sort.
 */
public class InMemoryMirrorStore implements MirrorStore {

    private final ConcurrentMap<String, ConcurrentNavigableMap<String, MirrorRecord>> byOrganization =
            new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MirrorRecord> byId = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMirrorStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMirrorStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<MirrorRecord> findById(String mirrorId) {
        return Optional.ofNullable(byId.get(mirrorId));
    }

    @Override
    public Optional<MirrorRecord> findByEntity(String organizationId, String entityId) {
        return Optional.ofNullable(rows(organizationId).get(entityId));
    }

    @Override
    public List<MirrorRecord> findByEntityIds(String organizationId, Collection<String> entityIds) {
        ConcurrentNavigableMap<String, MirrorRecord> rows = rows(organizationId);
        List<MirrorRecord> found = new ArrayList<>();
        for (String entityId : entityIds) {
            MirrorRecord mirror = rows.get(entityId);
            if (mirror != null) {
                found.add(mirror);
            }
        }
        return found;
    }

    @Override
    public MirrorRecord promote(String organizationId, String entityId, Document document) {
        MirrorRecord promoted = rows(organizationId).compute(entityId, (key, existing) -> existing == null
                ? new MirrorRecord(UUID.randomUUID().toString(), organizationId, entityId, document, 1, clock.instant())
                : existing.replacedBy(document, clock.instant()));
        byId.put(promoted.id(), promoted);
        return promoted;
    }

    @Override
    public MirrorRecord applyWriteBack(String mirrorId, Document confirmed, long remoteVersion) {
        MirrorRecord current = byId.get(mirrorId);
        if (current == null) {
            throw new NotFoundException("Mirror", mirrorId);
        }
        MirrorRecord replaced = rows(current.organizationId()).computeIfPresent(current.entityId(),
                (key, existing) -> existing.writtenBack(confirmed, remoteVersion, clock.instant()));
        if (replaced == null) {
            throw new NotFoundException("Mirror", mirrorId);
        }
        byId.put(mirrorId, replaced);
        return replaced;
    }

    @Override
    public List<MirrorRecord> query(String organizationId, MirrorFilter filter, PageRequest page) {
        return rows(organizationId).values().stream()
                .filter(filter::matches)
                .skip(page.offset())
                .limit(page.limit())
                .toList();
    }

    @Override
    public long count(String organizationId, MirrorFilter filter) {
        ConcurrentNavigableMap<String, MirrorRecord> rows = rows(organizationId);
        if (filter.isEmpty()) {
            return rows.size();
        }
        return rows.values().stream().filter(filter::matches).count();
    }

    private ConcurrentNavigableMap<String, MirrorRecord> rows(String organizationId) {
        return byOrganization.computeIfAbsent(organizationId, k -> new ConcurrentSkipListMap<>());
    }

    /**
     * Removes every row. Intended for tests.
     */
    public void clear() {
        byOrganization.clear();
        byId.clear();
    }
}
