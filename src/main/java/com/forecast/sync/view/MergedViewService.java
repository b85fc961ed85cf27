package com.forecast.sync.view;

import com.forecast.sync.api.Page;
import com.forecast.sync.api.PageRequest;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.delta.ModificationRepository;
import com.forecast.sync.mirror.MirrorFilter;
import com.forecast.sync.mirror.MirrorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Read side of the mirror-delta model.
 */
public class MergedViewService {
    private static final Logger log = LoggerFactory.getLogger(MergedViewService.class);

    private final MirrorStore mirrorStore;
    private final ModificationRepository modifications;

    public MergedViewService(MirrorStore mirrorStore, ModificationRepository modifications) {
        this.mirrorStore = mirrorStore;
        this.modifications = modifications;
    }

    /**
     * Mirror rows of the organization matching the filter, each overlaid with its active delta.
     *
     * @param requestingUserId only overlay this user's deltas, or null to overlay the most
     *                         recently updated active delta of any user
     * @return rows ordered by entity id
     */
    public List<MergedView> getMergedViews(String organizationId, MirrorFilter filter,
                                           String requestingUserId, PageRequest page) {
        List<MirrorRecord> mirrors = mirrorStore.query(organizationId, filter, page);
        if (mirrors.isEmpty()) {
            return List.of();
        }
        Map<String, Modification> active = modifications.findActiveByMirrors(
                mirrors.stream().map(MirrorRecord::id).toList(), requestingUserId);
        log.debug("views.merged organizationId={} rows={} withDelta={}", organizationId, mirrors.size(), active.size());
        return mirrors.stream()
                .map(mirror -> MergedView.of(mirror, active.get(mirror.id())))
                .toList();
    }

    public List<MergedView> getMergedViews(String organizationId, MirrorFilter filter, String requestingUserId) {
        return getMergedViews(organizationId, filter, requestingUserId, PageRequest.defaults());
    }

    /**
     * Number of mirror rows matching the filter, without loading documents.
     */
    public long getCount(String organizationId, MirrorFilter filter) {
        return mirrorStore.count(organizationId, filter);
    }

    public Page<MergedView> getPage(String organizationId, MirrorFilter filter, String requestingUserId,
                                    PageRequest page) {
        long total = getCount(organizationId, filter);
        if (total == 0) {
            return Page.empty(page);
        }
        return new Page<>(getMergedViews(organizationId, filter, requestingUserId, page), total,
                page.offset(), page.limit());
    }
}
