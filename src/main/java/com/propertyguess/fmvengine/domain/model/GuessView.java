package com.propertyguess.fmvengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Builder
public class GuessView {

    private final UUID id;
    private final UUID propertyId;
    private final UUID userId;
    private final BigDecimal guessedPrice;
    private final boolean outlier;
    private final long createdAtEpochMs;
    private final long updatedAtEpochMs;
    private final long editableAtEpochMs;
    private final Author author;

    @Getter
    @Builder
    public static class Author {
        private final UUID id;
        private final String username;
        private final String displayName;
        private final int karma;
        private final KarmaRank rank;
    }
}
