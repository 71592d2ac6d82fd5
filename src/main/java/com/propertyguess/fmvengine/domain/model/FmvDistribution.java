package com.propertyguess.fmvengine.domain.model;

import java.math.BigDecimal;

public record FmvDistribution(
        BigDecimal min,
        BigDecimal p10,
        BigDecimal p25,
        BigDecimal p50,
        BigDecimal p75,
        BigDecimal p90,
        BigDecimal max
) {

    public FmvDistribution {
        BigDecimal[] ordered = {min, p10, p25, p50, p75, p90, max};
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i] == null) {
                throw new IllegalArgumentException("distribution points must not be null");
            }
            if (i > 0 && ordered[i - 1].compareTo(ordered[i]) > 0) {
                throw new IllegalArgumentException("distribution points must be non-decreasing");
            }
        }
    }

    public BigDecimal median() {
        return p50;
    }
}
