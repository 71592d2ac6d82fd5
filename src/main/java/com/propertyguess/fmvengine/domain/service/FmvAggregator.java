package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.FmvConfidence;
import com.propertyguess.fmvengine.domain.model.FmvDistribution;
import com.propertyguess.fmvengine.domain.model.FmvResult;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.model.WeightedGuess;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import com.propertyguess.fmvengine.domain.service.fmv.AnchoringPolicy;
import com.propertyguess.fmvengine.domain.service.fmv.KarmaWeightedEstimator;
import com.propertyguess.fmvengine.domain.service.fmv.QuantileCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class FmvAggregator {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Comparator<PriceGuess> CHRONOLOGICAL =
            Comparator.comparingLong(PriceGuess::getCreatedAtEpochMs)
                    .thenComparing(PriceGuess::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PropertyLookup propertyLookup;
    private final PriceGuessRepository priceGuessRepository;
    private final UserKarmaLookup userKarmaLookup;
    private final KarmaWeightedEstimator weightedEstimator;
    private final AnchoringPolicy anchoringPolicy;
    private final MeterRegistry meterRegistry;

    private Timer computeTimer;

    @PostConstruct
    void initMetrics() {
        computeTimer = Timer.builder("fmv.compute.duration")
                .description("On-demand FMV aggregation duration")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public FmvResult compute(UUID propertyId) {
        if (!propertyLookup.exists(propertyId)) {
            throw FmvEngineException.propertyNotFound(propertyId);
        }
        return computeTimer.record(() -> {
            PropertyReference reference = propertyLookup.getReference(propertyId);
            List<PriceGuess> guesses = priceGuessRepository.findByPropertyId(propertyId);
            FmvResult result = aggregate(toWeighted(guesses), reference);

            log.debug("[FMV] propertyId={}, guesses={}, confidence={}, value={}, anchored={}",
                    propertyId, result.getGuessCount(), result.getConfidence(),
                    result.getValue(), result.isAnchored());
            return result;
        });
    }

    /**
     * Pure aggregation over an already loaded guess set.
     */
    public FmvResult aggregate(List<WeightedGuess> guesses, PropertyReference reference) {
        PropertyReference ref = reference == null ? PropertyReference.EMPTY : reference;
        if (guesses == null || guesses.isEmpty()) {
            return FmvResult.empty(ref);
        }

        FmvConfidence confidence = FmvConfidence.fromGuessCount(guesses.size());
        List<BigDecimal> prices = guesses.stream().map(WeightedGuess::guessedPrice).toList();
        FmvDistribution distribution = QuantileCalculator.distribution(prices);

        BigDecimal crowdEstimate = weightedEstimator.estimate(guesses)
                .orElse(distribution.median());
        AnchoringPolicy.AnchoredEstimate estimate = anchoringPolicy.apply(crowdEstimate, confidence, ref);

        return FmvResult.builder()
                .value(estimate.value())
                .confidence(confidence)
                .guessCount(guesses.size())
                .distribution(distribution)
                .assessedValue(ref.assessedValue())
                .askingPrice(ref.askingPrice())
                .divergence(divergence(ref, estimate.value()))
                .anchored(estimate.anchored())
                .build();
    }

    /**
     * Signed percentage of the asking price over the estimate; null when either side is missing.
     */
    static BigDecimal divergence(PropertyReference reference, BigDecimal value) {
        if (!reference.hasAskingPrice() || value == null || value.signum() <= 0) {
            return null;
        }
        return reference.askingPrice().subtract(value)
                .divide(value, MC)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private List<WeightedGuess> toWeighted(List<PriceGuess> guesses) {
        if (guesses.isEmpty()) {
            return List.of();
        }
        Set<UUID> authors = guesses.stream().map(PriceGuess::getUserId).collect(Collectors.toSet());
        Map<UUID, Integer> karmaByUser = userKarmaLookup.getKarmaByUser(authors);

        return guesses.stream()
                .sorted(CHRONOLOGICAL)
                .map(g -> new WeightedGuess(g.getGuessedPrice(), karmaByUser.get(g.getUserId()), g.isOutlier()))
                .toList();
    }
}
