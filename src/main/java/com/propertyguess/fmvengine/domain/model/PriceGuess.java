package com.propertyguess.fmvengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "price_guess",
        uniqueConstraints = @UniqueConstraint(name = "uk_price_guess_property_user",
                columnNames = {"propertyId", "userId"}),
        indexes = {
                @Index(name = "idx_price_guess_property_created", columnList = "propertyId, createdAtEpochMs"),
                @Index(name = "idx_price_guess_user", columnList = "userId")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceGuess {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID propertyId;

    @Column(nullable = false)
    private UUID userId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal guessedPrice;

    private boolean outlier;

    @Column(nullable = false, updatable = false)
    private long createdAtEpochMs;

    private long updatedAtEpochMs;
}
