package com.propertyguess.fmvengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Feedback on how a freshly submitted guess sits against the crowd estimate.
 */
@Getter
@Builder
public class ConsensusAlignment {

    private final Category category;
    private final BigDecimal percentDifference;
    private final BigDecimal alignmentPercentage;
    private final BigDecimal crowdEstimate;
    private final String message;

    public enum Category {
        ALIGNED, CLOSE, DIFFERENT
    }
}
