package com.propertyguess.fmvengine.domain.model;

import java.math.BigDecimal;

/**
 * A guessed price joined with its author's karma. {@code karma} is null when the
 * author could not be resolved.
 */
public record WeightedGuess(BigDecimal guessedPrice, Integer karma, boolean outlier) {

    public WeightedGuess {
        if (guessedPrice == null || guessedPrice.signum() <= 0) {
            throw new IllegalArgumentException("guessedPrice must be positive");
        }
    }
}
