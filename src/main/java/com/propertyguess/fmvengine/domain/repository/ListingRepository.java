package com.propertyguess.fmvengine.domain.repository;

import com.propertyguess.fmvengine.domain.model.ListingRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ListingRepository extends JpaRepository<ListingRecord, Long> {

    Optional<ListingRecord> findFirstByPropertyIdAndStatusOrderByCreatedAtEpochMsDesc(
            UUID propertyId, ListingRecord.Status status);
}
