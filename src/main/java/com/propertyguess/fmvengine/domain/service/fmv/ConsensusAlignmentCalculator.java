package com.propertyguess.fmvengine.domain.service.fmv;

import com.propertyguess.fmvengine.domain.model.ConsensusAlignment;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

@Component
@RequiredArgsConstructor
public class ConsensusAlignmentCalculator {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FmvProperties properties;

    /**
     * Returns null when there is no crowd estimate to compare against.
     *
     * @param otherPrices prices of every other guess on the property, excluding the submitted one
     */
    public ConsensusAlignment evaluate(BigDecimal submittedPrice, BigDecimal crowdEstimate, List<BigDecimal> otherPrices) {
        if (submittedPrice == null || crowdEstimate == null || crowdEstimate.signum() <= 0) {
            return null;
        }

        BigDecimal percentDiff = submittedPrice.subtract(crowdEstimate)
                .divide(crowdEstimate, MC)
                .multiply(HUNDRED);
        double absDiff = percentDiff.abs().doubleValue();

        FmvProperties.Alignment cfg = properties.getAlignment();
        ConsensusAlignment.Category category;
        if (absDiff <= cfg.getAlignedPct()) {
            category = ConsensusAlignment.Category.ALIGNED;
        } else if (absDiff <= cfg.getClosePct()) {
            category = ConsensusAlignment.Category.CLOSE;
        } else {
            category = ConsensusAlignment.Category.DIFFERENT;
        }

        BigDecimal agreement = agreementPercentage(submittedPrice, otherPrices);

        return ConsensusAlignment.builder()
                .category(category)
                .percentDifference(percentDiff.setScale(2, RoundingMode.HALF_UP))
                .alignmentPercentage(agreement)
                .crowdEstimate(crowdEstimate)
                .message(message(category, percentDiff, agreement))
                .build();
    }

    BigDecimal agreementPercentage(BigDecimal submittedPrice, List<BigDecimal> otherPrices) {
        if (otherPrices == null || otherPrices.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal band = BigDecimal.valueOf(properties.getAlignment().getAgreementBandPct()).divide(HUNDRED, MC);
        BigDecimal lower = submittedPrice.multiply(BigDecimal.ONE.subtract(band), MC);
        BigDecimal upper = submittedPrice.multiply(BigDecimal.ONE.add(band), MC);

        long within = otherPrices.stream()
                .filter(p -> p.compareTo(lower) >= 0 && p.compareTo(upper) <= 0)
                .count();
        return BigDecimal.valueOf(within).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(otherPrices.size()), 2, RoundingMode.HALF_UP);
    }

    private String message(ConsensusAlignment.Category category, BigDecimal percentDiff, BigDecimal agreement) {
        return switch (category) {
            case ALIGNED -> String.format("Your guess is in line with %d%% of other guesses",
                    agreement.setScale(0, RoundingMode.HALF_UP).intValue());
            case CLOSE -> "Your guess is close to the crowd estimate";
            case DIFFERENT -> String.format("Your guess is %d%% %s the crowd estimate",
                    percentDiff.abs().setScale(0, RoundingMode.HALF_UP).intValue(),
                    percentDiff.signum() > 0 ? "above" : "below");
        };
    }
}
