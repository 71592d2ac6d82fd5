package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.GuessOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

@Component
@RequiredArgsConstructor
public class GuessAccuracyClassifier {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FmvProperties properties;

    /**
     * {@link GuessOutcome#PENDING} until a positive sold price exists. Bands are inclusive.
     */
    public GuessOutcome classify(BigDecimal guessedPrice, BigDecimal soldPrice) {
        if (guessedPrice == null || soldPrice == null || soldPrice.signum() <= 0) {
            return GuessOutcome.PENDING;
        }
        double deviationPct = guessedPrice.subtract(soldPrice).abs()
                .divide(soldPrice, MC)
                .multiply(HUNDRED)
                .doubleValue();

        FmvProperties.History bands = properties.getHistory();
        if (deviationPct <= bands.getAccuratePct()) return GuessOutcome.ACCURATE;
        if (deviationPct <= bands.getClosePct()) return GuessOutcome.CLOSE;
        return GuessOutcome.INACCURATE;
    }
}
