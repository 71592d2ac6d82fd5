package com.propertyguess.fmvengine.infra.cache;

import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import com.propertyguess.fmvengine.domain.service.PropertyReferenceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fmv.cache", name = "backend", havingValue = "redis")
public class RedisPropertyReferenceCache implements PropertyReferenceCache {

    static final String KEY_PREFIX = "fmv:ref:";

    private final RedisTemplate<String, PropertyReference> propertyReferenceRedisTemplate;
    private final FmvProperties properties;

    @Override
    public Optional<PropertyReference> get(UUID propertyId) {
        if (propertyId == null) return Optional.empty();
        return Optional.ofNullable(propertyReferenceRedisTemplate.opsForValue().get(key(propertyId)));
    }

    @Override
    public void put(UUID propertyId, PropertyReference reference) {
        if (propertyId == null || reference == null) return;
        propertyReferenceRedisTemplate.opsForValue().set(key(propertyId), reference, properties.getCache().getTtl());
        log.debug("[Redis] 참조값 캐시 저장: propertyId={}, ttl={}", propertyId, properties.getCache().getTtl());
    }

    @Override
    public void evict(UUID propertyId) {
        if (propertyId == null) return;
        propertyReferenceRedisTemplate.delete(key(propertyId));
    }

    private String key(UUID propertyId) {
        return KEY_PREFIX + propertyId;
    }
}
