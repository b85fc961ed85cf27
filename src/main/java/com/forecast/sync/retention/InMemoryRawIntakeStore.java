package com.forecast.sync.retention;

import com.forecast.sync.core.model.RawIntakeRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Raw intake kept in a skip list ordered by (ingestedAt, id).
 */
public class InMemoryRawIntakeStore implements RawIntakeStore {

    private final ConcurrentSkipListMap<Cursor, RawIntakeRecord> rows = new ConcurrentSkipListMap<>();
    private final Map<String, Cursor> positions = new ConcurrentHashMap<>();

    @Override
    public void append(RawIntakeRecord record) {
        Cursor position = Cursor.of(record);
        if (positions.putIfAbsent(record.id(), position) != null) {
            throw new IllegalStateException("Raw intake record already exists: " + record.id());
        }
        rows.put(position, record);
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    public long countIngestedBefore(Instant cutoff) {
        return rows.headMap(new Cursor(cutoff, ""), false).size();
    }

    @Override
    public List<RawIntakeRecord> findBatch(Instant cutoff, Cursor after, int limit) {
        NavigableMap<Cursor, RawIntakeRecord> eligible = rows.headMap(new Cursor(cutoff, ""), false);
        if (after != null) {
            eligible = eligible.tailMap(after, false);
        }
        List<RawIntakeRecord> batch = new ArrayList<>(Math.min(limit, 1024));
        for (RawIntakeRecord record : eligible.values()) {
            if (batch.size() >= limit) {
                break;
            }
            batch.add(record);
        }
        return batch;
    }

    @Override
    public int deleteByIds(Collection<String> ids) {
        int deleted = 0;
        for (String id : ids) {
            Cursor position = positions.remove(id);
            if (position != null && rows.remove(position) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public Optional<Instant> oldestIngestedAt() {
        Map.Entry<Cursor, RawIntakeRecord> first = rows.firstEntry();
        return first == null ? Optional.empty() : Optional.of(first.getKey().ingestedAt());
    }

    @Override
    public Optional<Instant> newestIngestedAt() {
        Map.Entry<Cursor, RawIntakeRecord> last = rows.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getKey().ingestedAt());
    }
}
