package com.propertyguess.fmvengine.domain.repository;

import com.propertyguess.fmvengine.domain.model.PriceGuess;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PriceGuessRepository extends JpaRepository<PriceGuess, UUID> {

    Optional<PriceGuess> findByPropertyIdAndUserId(UUID propertyId, UUID userId);

    List<PriceGuess> findByPropertyId(UUID propertyId);

    Page<PriceGuess> findByPropertyIdOrderByCreatedAtEpochMsAscIdAsc(UUID propertyId, Pageable pageable);

    long countByPropertyId(UUID propertyId);

    Page<PriceGuess> findByUserIdOrderByCreatedAtEpochMsDescIdDesc(UUID userId, Pageable pageable);

    /**
     * Applies an edit only if the row has not been touched since {@code cooldownCutoffEpochMs}.
     * Returns the number of rows changed (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PriceGuess g SET g.guessedPrice = :price, g.outlier = :outlier, " +
            "g.updatedAtEpochMs = :now " +
            "WHERE g.id = :id AND g.updatedAtEpochMs <= :cooldownCutoffEpochMs")
    int updateIfCooldownElapsed(@Param("id") UUID id,
                                @Param("price") BigDecimal price,
                                @Param("outlier") boolean outlier,
                                @Param("now") long now,
                                @Param("cooldownCutoffEpochMs") long cooldownCutoffEpochMs);
}
