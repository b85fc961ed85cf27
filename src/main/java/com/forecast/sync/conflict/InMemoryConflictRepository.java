package com.forecast.sync.conflict;

import com.forecast.sync.core.model.SyncConflict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory conflict repository keyed by modification id.
 */
public class InMemoryConflictRepository implements ConflictRepository {

    private final ConcurrentMap<String, List<SyncConflict>> byModification = new ConcurrentHashMap<>();

    @Override
    public void saveAll(List<SyncConflict> conflicts) {
        for (SyncConflict conflict : conflicts) {
            byModification.compute(conflict.modificationId(), (id, existing) -> {
                List<SyncConflict> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
                updated.add(conflict);
                return List.copyOf(updated);
            });
        }
    }

    @Override
    public List<SyncConflict> findByModification(String modificationId) {
        return byModification.getOrDefault(modificationId, List.of());
    }

    @Override
    public List<SyncConflict> findByOrganization(String organizationId) {
        return byModification.values().stream()
                .flatMap(List::stream)
                .filter(c -> c.organizationId().equals(organizationId))
                .sorted(Comparator.comparing(SyncConflict::detectedAt).reversed()
                        .thenComparing(SyncConflict::fieldName))
                .toList();
    }

    @Override
    public int deleteByModification(String modificationId) {
        List<SyncConflict> removed = byModification.remove(modificationId);
        return removed == null ? 0 : removed.size();
    }
}
