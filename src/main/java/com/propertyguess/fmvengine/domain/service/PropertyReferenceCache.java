package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.PropertyReference;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

public interface PropertyReferenceCache {

    Optional<PropertyReference> get(UUID propertyId);

    void put(UUID propertyId, PropertyReference reference);

    void evict(UUID propertyId);

    default PropertyReference getOrLoad(UUID propertyId, Function<UUID, PropertyReference> loader) {
        Optional<PropertyReference> cached = get(propertyId);
        if (cached.isPresent()) {
            return cached.get();
        }
        PropertyReference loaded = loader.apply(propertyId);
        put(propertyId, loaded);
        return loaded;
    }
}
