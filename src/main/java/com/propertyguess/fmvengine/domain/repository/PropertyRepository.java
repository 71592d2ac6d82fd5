package com.propertyguess.fmvengine.domain.repository;

import com.propertyguess.fmvengine.domain.model.PropertyRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PropertyRepository extends JpaRepository<PropertyRecord, UUID> {
}
