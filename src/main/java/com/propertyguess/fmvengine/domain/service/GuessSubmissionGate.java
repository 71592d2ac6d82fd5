package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.ConsensusAlignment;
import com.propertyguess.fmvengine.domain.model.FmvResult;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.model.SubmissionResult;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import com.propertyguess.fmvengine.domain.service.fmv.ConsensusAlignmentCalculator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class GuessSubmissionGate {

    private final PropertyLookup propertyLookup;
    private final MemeGuessDetector memeGuessDetector;
    private final GuessWriter guessWriter;
    private final FmvAggregator fmvAggregator;
    private final PriceGuessRepository priceGuessRepository;
    private final ConsensusAlignmentCalculator alignmentCalculator;
    private final FmvProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private Counter createdCounter;
    private Counter updatedCounter;
    private Counter cooldownCounter;
    private Counter rejectedCounter;

    @PostConstruct
    void initMetrics() {
        createdCounter = submissionCounter("created");
        updatedCounter = submissionCounter("updated");
        cooldownCounter = submissionCounter("cooldown");
        rejectedCounter = submissionCounter("rejected");
    }

    public SubmissionResult submit(UUID propertyId, UUID userId, BigDecimal guessedPrice) {
        try {
            validate(userId, guessedPrice);
            if (!propertyLookup.exists(propertyId)) {
                throw FmvEngineException.propertyNotFound(propertyId);
            }

            PropertyReference reference = propertyLookup.getReference(propertyId);
            boolean outlier = memeGuessDetector.isOutlier(guessedPrice, reference.assessedValue());
            long now = clock.millis();

            GuessWriter.Written written = writeOnce(propertyId, userId, guessedPrice, outlier, now);
            PriceGuess guess = written.guess();
            if (written.outcome() == SubmissionResult.Outcome.CREATED) {
                createdCounter.increment();
            } else {
                updatedCounter.increment();
            }

            log.info("[GuessGate] {} propertyId={}, userId={}, price={}, outlier={}",
                    written.outcome(), propertyId, userId, guessedPrice, outlier);

            long editableAt = guess.getUpdatedAtEpochMs() + properties.getSubmission().getCooldown().toMillis();
            return new SubmissionResult(guess, written.outcome(), editableAt, consensusFor(guess));
        } catch (FmvEngineException e) {
            if (e.getKind() == FmvEngineException.FailureKind.COOLDOWN_ACTIVE) {
                cooldownCounter.increment();
            } else {
                rejectedCounter.increment();
            }
            log.info("[GuessGate] 제출 거부: kind={}, propertyId={}, userId={}", e.getKind(), propertyId, userId);
            throw e;
        }
    }

    private void validate(UUID userId, BigDecimal guessedPrice) {
        if (userId == null) {
            throw FmvEngineException.unauthorized();
        }
        if (guessedPrice == null) {
            throw FmvEngineException.invalidInput("guessedPrice is required");
        }
        if (guessedPrice.signum() <= 0) {
            throw FmvEngineException.invalidInput("guessedPrice must be positive");
        }
        if (guessedPrice.compareTo(properties.getSubmission().getMaxPrice()) > 0) {
            throw FmvEngineException.invalidInput("guessedPrice exceeds maximum value");
        }
        if (guessedPrice.stripTrailingZeros().scale() > 2) {
            throw FmvEngineException.invalidInput("guessedPrice must have at most two decimal places");
        }
    }

    /**
     * A concurrent first submission from the same user loses on the unique constraint and is
     * replayed once through the update path, where it meets the cooldown.
     */
    private GuessWriter.Written writeOnce(UUID propertyId, UUID userId, BigDecimal price, boolean outlier, long now) {
        try {
            return guessWriter.write(propertyId, userId, price, outlier, now);
        } catch (DataIntegrityViolationException e) {
            log.warn("[GuessGate] 중복 최초 제출 감지, 수정 경로로 재시도: propertyId={}, userId={}", propertyId, userId);
            return guessWriter.write(propertyId, userId, price, outlier, now);
        }
    }

    private ConsensusAlignment consensusFor(PriceGuess guess) {
        FmvResult fmv = fmvAggregator.compute(guess.getPropertyId());
        List<BigDecimal> otherPrices = priceGuessRepository.findByPropertyId(guess.getPropertyId()).stream()
                .filter(g -> !g.getUserId().equals(guess.getUserId()))
                .map(PriceGuess::getGuessedPrice)
                .toList();
        return alignmentCalculator.evaluate(guess.getGuessedPrice(), fmv.getValue(), otherPrices);
    }

    private Counter submissionCounter(String outcome) {
        return Counter.builder("fmv.guess.submissions")
                .tag("outcome", outcome)
                .description("Price guess submissions by outcome")
                .register(meterRegistry);
    }
}
