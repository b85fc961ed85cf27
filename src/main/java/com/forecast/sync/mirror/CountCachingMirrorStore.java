package com.forecast.sync.mirror;

import com.forecast.sync.api.PageRequest;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decorates a {@link MirrorStore} with a Caffeine cache of {@link #count} results. Any write to
 * an organization's rows drops that organization's cached counts.
 */
public class CountCachingMirrorStore implements MirrorStore {
    private static final Logger log = LoggerFactory.getLogger(CountCachingMirrorStore.class);

    private final MirrorStore delegate;
    private final Cache<CountKey, Long> counts;

    public CountCachingMirrorStore(MirrorStore delegate, CountCacheConfig config) {
        this.delegate = delegate;
        this.counts = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("mirror.countCache initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<MirrorRecord> findById(String mirrorId) {
        return delegate.findById(mirrorId);
    }

    @Override
    public Optional<MirrorRecord> findByEntity(String organizationId, String entityId) {
        return delegate.findByEntity(organizationId, entityId);
    }

    @Override
    public List<MirrorRecord> findByEntityIds(String organizationId, Collection<String> entityIds) {
        return delegate.findByEntityIds(organizationId, entityIds);
    }

    @Override
    public MirrorRecord promote(String organizationId, String entityId, Document document) {
        MirrorRecord promoted = delegate.promote(organizationId, entityId, document);
        invalidate(organizationId);
        return promoted;
    }

    @Override
    public MirrorRecord applyWriteBack(String mirrorId, Document confirmed, long remoteVersion) {
        MirrorRecord replaced = delegate.applyWriteBack(mirrorId, confirmed, remoteVersion);
        invalidate(replaced.organizationId());
        return replaced;
    }

    @Override
    public List<MirrorRecord> query(String organizationId, MirrorFilter filter, PageRequest page) {
        return delegate.query(organizationId, filter, page);
    }

    @Override
    public long count(String organizationId, MirrorFilter filter) {
        return counts.get(new CountKey(organizationId, filter), key -> delegate.count(organizationId, filter));
    }

    /**
     * Drops every cached count of the organization.
     */
    public void invalidate(String organizationId) {
        counts.asMap().keySet().removeIf(key -> key.organizationId().equals(organizationId));
    }

    record CountKey(String organizationId, MirrorFilter filter) {}
}
