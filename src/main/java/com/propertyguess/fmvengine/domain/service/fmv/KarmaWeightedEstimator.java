package com.propertyguess.fmvengine.domain.service.fmv;

import com.propertyguess.fmvengine.domain.model.KarmaRank;
import com.propertyguess.fmvengine.domain.model.WeightedGuess;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import com.propertyguess.fmvengine.domain.service.KarmaRankResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Weighted mean of guessed prices where each author's karma tier lifts the weight:
 * {@code weight = 1 + tierStep * (level - 1)}, times {@code outlierWeight} for meme guesses.
 * Weights are normalized to sum to the guess count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KarmaWeightedEstimator {

    private static final MathContext MC = new MathContext(20, RoundingMode.HALF_EVEN);

    private final KarmaRankResolver karmaRankResolver;
    private final FmvProperties properties;

    /**
     * Empty when no guess carries karma data or every weight is zero; callers fall back to the median.
     */
    public Optional<BigDecimal> estimate(List<WeightedGuess> guesses) {
        if (guesses == null || guesses.isEmpty()) {
            return Optional.empty();
        }
        boolean anyKarma = guesses.stream().anyMatch(g -> g.karma() != null);
        if (!anyKarma) {
            log.debug("[Weighting] 카르마 데이터 없음: guesses={}, 중앙값으로 대체", guesses.size());
            return Optional.empty();
        }

        List<BigDecimal> weights = normalizedWeights(guesses);
        if (weights.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal weightedSum = BigDecimal.ZERO;
        for (int i = 0; i < guesses.size(); i++) {
            weightedSum = weightedSum.add(guesses.get(i).guessedPrice().multiply(weights.get(i), MC), MC);
        }
        BigDecimal mean = weightedSum.divide(BigDecimal.valueOf(guesses.size()), MC);
        return Optional.of(mean.setScale(QuantileCalculator.SCALE, RoundingMode.HALF_UP));
    }

    /**
     * Returns an empty list when the raw weights sum to zero.
     */
    public List<BigDecimal> normalizedWeights(List<WeightedGuess> guesses) {
        List<BigDecimal> raw = new ArrayList<>(guesses.size());
        BigDecimal total = BigDecimal.ZERO;
        for (WeightedGuess guess : guesses) {
            BigDecimal w = rawWeight(guess);
            raw.add(w);
            total = total.add(w, MC);
        }
        if (total.signum() <= 0) {
            return List.of();
        }

        BigDecimal scale = BigDecimal.valueOf(guesses.size()).divide(total, MC);
        List<BigDecimal> normalized = new ArrayList<>(raw.size());
        for (BigDecimal w : raw) {
            normalized.add(w.multiply(scale, MC));
        }
        return normalized;
    }

    BigDecimal rawWeight(WeightedGuess guess) {
        KarmaRank rank = karmaRankResolver.resolve(guess.karma());
        FmvProperties.Weighting weighting = properties.getWeighting();
        double weight = 1.0 + weighting.getTierStep() * (rank.level() - 1);
        if (guess.outlier()) {
            weight *= weighting.getOutlierWeight();
        }
        return BigDecimal.valueOf(Math.max(0.0, weight));
    }
}
