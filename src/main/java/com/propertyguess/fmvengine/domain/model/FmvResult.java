package com.propertyguess.fmvengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Point-in-time crowd valuation of a property. Recomputed on every read, never stored.
 */
@Getter
@Builder
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmvResult {

    private BigDecimal value;
    private FmvConfidence confidence;
    private int guessCount;
    private FmvDistribution distribution;
    private BigDecimal assessedValue;
    private BigDecimal askingPrice;
    private BigDecimal divergence;
    private boolean anchored;

    public static FmvResult empty(PropertyReference reference) {
        return FmvResult.builder()
                .confidence(FmvConfidence.NONE)
                .guessCount(0)
                .assessedValue(reference.assessedValue())
                .askingPrice(reference.askingPrice())
                .build();
    }
}
