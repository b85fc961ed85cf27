package com.forecast.sync.retention;

import com.forecast.sync.core.model.RawIntakeRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of raw intake. Rows leave only through {@link #deleteByIds}.
 */
public interface RawIntakeStore {

    void append(RawIntakeRecord record);

    default void appendAll(Collection<RawIntakeRecord> records) {
        records.forEach(this::append);
    }

    long count();

    long countIngestedBefore(Instant cutoff);

    /**
     * Returns up to {@code limit} rows ingested strictly before {@code cutoff}, ordered by
     * ingestion time then id, starting after {@code after} (or from the oldest row when null).
     */
    List<RawIntakeRecord> findBatch(Instant cutoff, Cursor after, int limit);

    int deleteByIds(Collection<String> ids);

    Optional<Instant> oldestIngestedAt();

    Optional<Instant> newestIngestedAt();

    /**
     * Keyset position in (ingestedAt, id) order.
     */
    record Cursor(Instant ingestedAt, String id) implements Comparable<Cursor> {

        private static final Comparator<Cursor> ORDER =
                Comparator.comparing(Cursor::ingestedAt).thenComparing(Cursor::id);

        public static Cursor of(RawIntakeRecord record) {
            return new Cursor(record.ingestedAt(), record.id());
        }

        @Override
        public int compareTo(Cursor other) {
            return ORDER.compare(this, other);
        }
    }
}
