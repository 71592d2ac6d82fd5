package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.PropertyReference;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of the property catalog.
 */
public interface PropertyLookup {

    boolean exists(UUID propertyId);

    PropertyReference getReference(UUID propertyId);

    /**
     * Price of the most recent sale, or null while the property is unsold.
     */
    BigDecimal getSoldPrice(UUID propertyId);

    /**
     * Display address per property. Unknown ids are absent.
     */
    Map<UUID, String> getDisplayAddresses(Collection<UUID> propertyIds);
}
