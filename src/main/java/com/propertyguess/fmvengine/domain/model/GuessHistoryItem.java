package com.propertyguess.fmvengine.domain.model;

import java.math.BigDecimal;
import java.util.UUID;

public record GuessHistoryItem(
        UUID propertyId,
        String propertyAddress,
        BigDecimal guessedPrice,
        long guessedAtEpochMs,
        GuessOutcome outcome,
        BigDecimal actualPrice
) {
}
