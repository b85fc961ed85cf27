package com.forecast.sync.view;

import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;

import java.time.Instant;

/**
 * A mirror row as a user sees it: the mirror document with the active delta overlaid. Computed
 * at read time and never stored.
 *
 * @param syncState {@code pristine} when no active delta exists, otherwise the delta's state code
 */
public record MergedView(
        String mirrorId,
        String entityId,
        Document document,
        long mirrorVersion,
        boolean hasModifications,
        String syncState,
        String modifiedBy,
        Instant modifiedAt,
        String modificationId
) {
    public static final String PRISTINE = "pristine";

    static MergedView of(MirrorRecord mirror, Modification delta) {
        if (delta == null) {
            return new MergedView(mirror.id(), mirror.entityId(), mirror.document(), mirror.version(),
                    false, PRISTINE, null, null, null);
        }
        return new MergedView(mirror.id(), mirror.entityId(), merge(mirror.document(), delta.getDelta()),
                mirror.version(), true, delta.getSyncState().code(), delta.getUserId(),
                delta.getUpdatedAt(), delta.getId());
    }

    /**
     * Shallow overlay of {@code delta} on {@code mirror}: delta wins on every key it holds.
     */
    public static Document merge(Document mirror, Document delta) {
        return mirror.overlay(delta);
    }
}
