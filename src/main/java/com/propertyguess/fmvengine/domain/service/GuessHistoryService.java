package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.GuessHistory;
import com.propertyguess.fmvengine.domain.model.GuessHistoryItem;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A user's own guesses across all properties, newest first, each scored against the sale price once known.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuessHistoryService {

    private final PriceGuessRepository priceGuessRepository;
    private final PropertyLookup propertyLookup;
    private final GuessAccuracyClassifier accuracyClassifier;

    @Transactional(readOnly = true)
    public GuessHistory history(UUID userId, int page, int pageSize) {
        if (userId == null) {
            throw FmvEngineException.unauthorized();
        }

        int safePage = Math.max(1, page);
        int safeSize = Math.min(GuessQueryService.MAX_PAGE_SIZE, Math.max(1, pageSize));

        Page<PriceGuess> result = priceGuessRepository.findByUserIdOrderByCreatedAtEpochMsDescIdDesc(
                userId, PageRequest.of(safePage - 1, safeSize));

        Set<UUID> propertyIds = result.getContent().stream()
                .map(PriceGuess::getPropertyId)
                .collect(Collectors.toSet());
        Map<UUID, String> addresses = propertyIds.isEmpty() ? Map.of() : propertyLookup.getDisplayAddresses(propertyIds);
        Map<UUID, BigDecimal> soldPrices = new HashMap<>();
        for (UUID propertyId : propertyIds) {
            BigDecimal sold = propertyLookup.getSoldPrice(propertyId);
            if (sold != null) {
                soldPrices.put(propertyId, sold);
            }
        }

        List<GuessHistoryItem> items = result.getContent().stream()
                .map(g -> {
                    BigDecimal sold = soldPrices.get(g.getPropertyId());
                    return new GuessHistoryItem(
                            g.getPropertyId(),
                            addresses.get(g.getPropertyId()),
                            g.getGuessedPrice(),
                            g.getCreatedAtEpochMs(),
                            accuracyClassifier.classify(g.getGuessedPrice(), sold),
                            sold);
                })
                .toList();

        log.debug("[GuessHistory] userId={}, page={}, size={}, total={}",
                userId, safePage, safeSize, result.getTotalElements());

        return new GuessHistory(items, safePage, safeSize, result.getTotalElements(), result.hasNext());
    }
}
