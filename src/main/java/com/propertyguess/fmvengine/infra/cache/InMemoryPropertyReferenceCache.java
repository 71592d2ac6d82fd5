package com.propertyguess.fmvengine.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import com.propertyguess.fmvengine.domain.service.PropertyReferenceCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Caffeine-backed cache bounded by {@code fmv.cache.max-entries}, entries expire {@code fmv.cache.ttl}
 * after they were written. Time is read from the injected clock.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "fmv.cache", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryPropertyReferenceCache implements PropertyReferenceCache {

    private final Cache<UUID, PropertyReference> cache;

    public InMemoryPropertyReferenceCache(FmvProperties properties, Clock clock) {
        FmvProperties.Cache cfg = properties.getCache();
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, cfg.getMaxEntries()))
                .expireAfterWrite(cfg.getTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        log.info("[RefCache] 인메모리 캐시 초기화: ttl={}, maxEntries={}", cfg.getTtl(), cfg.getMaxEntries());
    }

    @Override
    public Optional<PropertyReference> get(UUID propertyId) {
        if (propertyId == null) return Optional.empty();
        return Optional.ofNullable(cache.getIfPresent(propertyId));
    }

    @Override
    public void put(UUID propertyId, PropertyReference reference) {
        if (propertyId == null || reference == null) return;
        cache.put(propertyId, reference);
    }

    @Override
    public void evict(UUID propertyId) {
        if (propertyId == null) return;
        cache.invalidate(propertyId);
    }

    @Override
    public PropertyReference getOrLoad(UUID propertyId, Function<UUID, PropertyReference> loader) {
        return cache.get(propertyId, loader);
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
