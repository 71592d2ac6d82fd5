package com.propertyguess.fmvengine.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

@Slf4j
@Component
@RequiredArgsConstructor
public class MemeGuessDetector {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    private final FmvProperties properties;

    public boolean isOutlier(BigDecimal guessedPrice, BigDecimal referenceValue) {
        if (guessedPrice == null || referenceValue == null || referenceValue.signum() <= 0) {
            return false;
        }

        double ratio = guessedPrice.divide(referenceValue, MC).doubleValue();
        FmvProperties.Outlier band = properties.getOutlier();
        boolean outlier = ratio < band.getMinRatio() || ratio > band.getMaxRatio();

        if (outlier) {
            log.debug("[MemeGuess] 밴드 이탈: guess={}, reference={}, ratio={}, band=[{}, {}]",
                    guessedPrice, referenceValue, String.format("%.4f", ratio),
                    band.getMinRatio(), band.getMaxRatio());
        }
        return outlier;
    }
}
