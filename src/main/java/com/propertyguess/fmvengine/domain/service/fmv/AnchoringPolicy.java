package com.propertyguess.fmvengine.domain.service.fmv;

import com.propertyguess.fmvengine.domain.model.FmvConfidence;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pulls a thin-sample crowd estimate toward the assessed value.
 */
@Component
@RequiredArgsConstructor
public class AnchoringPolicy {

    private final FmvProperties properties;

    public AnchoredEstimate apply(BigDecimal crowdEstimate, FmvConfidence confidence, PropertyReference reference) {
        double blend = blendRatio(confidence);
        if (crowdEstimate == null || blend <= 0.0 || reference == null || !reference.hasAssessedValue()) {
            return new AnchoredEstimate(crowdEstimate, false);
        }

        BigDecimal ratio = BigDecimal.valueOf(Math.min(1.0, blend));
        BigDecimal anchored = reference.assessedValue().multiply(ratio)
                .add(crowdEstimate.multiply(BigDecimal.ONE.subtract(ratio)))
                .setScale(QuantileCalculator.SCALE, RoundingMode.HALF_UP);
        return new AnchoredEstimate(anchored, true);
    }

    public double blendRatio(FmvConfidence confidence) {
        FmvProperties.Anchoring anchoring = properties.getAnchoring();
        return switch (confidence) {
            case LOW -> anchoring.getLowBlend();
            case MEDIUM -> anchoring.getMediumBlend();
            case HIGH -> anchoring.getHighBlend();
            case NONE -> 0.0;
        };
    }

    public record AnchoredEstimate(BigDecimal value, boolean anchored) {
    }
}
