package com.propertyguess.fmvengine.infra.catalog;

import com.propertyguess.fmvengine.domain.model.ListingRecord;
import com.propertyguess.fmvengine.domain.model.PropertyRecord;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.repository.ListingRepository;
import com.propertyguess.fmvengine.domain.repository.PropertyRepository;
import com.propertyguess.fmvengine.domain.service.PropertyLookup;
import com.propertyguess.fmvengine.domain.service.PropertyReferenceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPropertyLookup implements PropertyLookup {

    private final PropertyRepository propertyRepository;
    private final ListingRepository listingRepository;
    private final PropertyReferenceCache referenceCache;

    @Override
    public boolean exists(UUID propertyId) {
        return propertyId != null && propertyRepository.existsById(propertyId);
    }

    @Override
    public PropertyReference getReference(UUID propertyId) {
        if (propertyId == null) return PropertyReference.EMPTY;
        return referenceCache.getOrLoad(propertyId, this::load);
    }

    @Override
    public BigDecimal getSoldPrice(UUID propertyId) {
        if (propertyId == null) return null;
        return listingRepository
                .findFirstByPropertyIdAndStatusOrderByCreatedAtEpochMsDesc(propertyId, ListingRecord.Status.SOLD)
                .map(ListingRecord::getSoldPrice)
                .orElse(null);
    }

    @Override
    public Map<UUID, String> getDisplayAddresses(Collection<UUID> propertyIds) {
        Map<UUID, String> addresses = new HashMap<>();
        if (propertyIds == null || propertyIds.isEmpty()) return addresses;

        for (PropertyRecord property : propertyRepository.findAllById(propertyIds)) {
            addresses.put(property.getId(), displayAddress(property));
        }
        return addresses;
    }

    private static String displayAddress(PropertyRecord property) {
        if (property.getCity() == null || property.getCity().isBlank()) {
            return property.getAddress();
        }
        return property.getAddress() + ", " + property.getCity();
    }

    private PropertyReference load(UUID propertyId) {
        BigDecimal assessed = propertyRepository.findById(propertyId)
                .map(PropertyRecord::getAssessedValue)
                .orElse(null);
        BigDecimal asking = listingRepository
                .findFirstByPropertyIdAndStatusOrderByCreatedAtEpochMsDesc(propertyId, ListingRecord.Status.ACTIVE)
                .map(ListingRecord::getAskingPrice)
                .orElse(null);

        log.debug("[Catalog] 참조값 로드: propertyId={}, assessed={}, asking={}", propertyId, assessed, asking);
        return new PropertyReference(assessed, asking);
    }
}
