package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.model.SubmissionResult;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-row write for one (property, user) pair. Inserts lean on the unique constraint,
 * edits go through a conditional update so a stale read of {@code updatedAt} cannot skip the cooldown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuessWriter {

    private final PriceGuessRepository priceGuessRepository;
    private final FmvProperties properties;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Written write(UUID propertyId, UUID userId, BigDecimal guessedPrice, boolean outlier, long nowEpochMs) {
        long cooldownMs = properties.getSubmission().getCooldown().toMillis();
        Optional<PriceGuess> existing = priceGuessRepository.findByPropertyIdAndUserId(propertyId, userId);

        if (existing.isEmpty()) {
            PriceGuess created = priceGuessRepository.saveAndFlush(PriceGuess.builder()
                    .propertyId(propertyId)
                    .userId(userId)
                    .guessedPrice(guessedPrice)
                    .outlier(outlier)
                    .createdAtEpochMs(nowEpochMs)
                    .updatedAtEpochMs(nowEpochMs)
                    .build());
            return new Written(created, SubmissionResult.Outcome.CREATED);
        }

        PriceGuess guess = existing.get();
        long cooldownEnd = guess.getUpdatedAtEpochMs() + cooldownMs;
        if (nowEpochMs < cooldownEnd) {
            throw FmvEngineException.cooldownActive(Instant.ofEpochMilli(cooldownEnd));
        }

        int changed = priceGuessRepository.updateIfCooldownElapsed(
                guess.getId(), guessedPrice, outlier, nowEpochMs, nowEpochMs - cooldownMs);
        if (changed == 0) {
            PriceGuess current = priceGuessRepository.findById(guess.getId()).orElse(guess);
            log.warn("[GuessWriter] 동시 수정 감지: guessId={}, updatedAt={}", current.getId(), current.getUpdatedAtEpochMs());
            throw FmvEngineException.cooldownActive(Instant.ofEpochMilli(current.getUpdatedAtEpochMs() + cooldownMs));
        }

        PriceGuess updated = priceGuessRepository.findById(guess.getId())
                .orElseThrow(() -> new IllegalStateException("updated guess vanished: " + guess.getId()));
        return new Written(updated, SubmissionResult.Outcome.UPDATED);
    }

    public record Written(PriceGuess guess, SubmissionResult.Outcome outcome) {
    }
}
