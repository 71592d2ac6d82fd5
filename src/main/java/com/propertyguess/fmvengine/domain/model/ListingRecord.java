package com.propertyguess.fmvengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "listing", indexes = {
        @Index(name = "idx_listing_property_status", columnList = "propertyId, status, createdAtEpochMs")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID propertyId;

    @Column(precision = 15, scale = 2)
    private BigDecimal askingPrice;

    @Column(precision = 15, scale = 2)
    private BigDecimal soldPrice;

    @Enumerated(EnumType.STRING)
    private Status status;

    private long createdAtEpochMs;

    public enum Status {
        ACTIVE, SOLD, WITHDRAWN
    }
}
