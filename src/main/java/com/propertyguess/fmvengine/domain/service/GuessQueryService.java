package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.AuthorProfile;
import com.propertyguess.fmvengine.domain.model.FmvResult;
import com.propertyguess.fmvengine.domain.model.GuessPage;
import com.propertyguess.fmvengine.domain.model.GuessView;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class GuessQueryService {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final PropertyLookup propertyLookup;
    private final PriceGuessRepository priceGuessRepository;
    private final UserKarmaLookup userKarmaLookup;
    private final KarmaRankResolver karmaRankResolver;
    private final FmvAggregator fmvAggregator;
    private final FmvProperties properties;

    /**
     * @param page 1-based page number
     */
    @Transactional(readOnly = true)
    public GuessPage list(UUID propertyId, int page, int pageSize) {
        if (!propertyLookup.exists(propertyId)) {
            throw FmvEngineException.propertyNotFound(propertyId);
        }

        int safePage = Math.max(1, page);
        int safeSize = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));

        Page<PriceGuess> result = priceGuessRepository.findByPropertyIdOrderByCreatedAtEpochMsAscIdAsc(
                propertyId, PageRequest.of(safePage - 1, safeSize));

        Set<UUID> authors = result.getContent().stream()
                .map(PriceGuess::getUserId)
                .collect(Collectors.toSet());
        Map<UUID, AuthorProfile> profiles = authors.isEmpty() ? Map.of() : userKarmaLookup.getProfiles(authors);

        long cooldownMs = properties.getSubmission().getCooldown().toMillis();
        List<GuessView> views = result.getContent().stream()
                .map(g -> toView(g, profiles.get(g.getUserId()), cooldownMs))
                .toList();

        FmvResult fmv = fmvAggregator.compute(propertyId);

        log.debug("[GuessQuery] propertyId={}, page={}, size={}, total={}",
                propertyId, safePage, safeSize, result.getTotalElements());

        return new GuessPage(views, safePage, safeSize, result.getTotalElements(), result.getTotalPages(), fmv);
    }

    private GuessView toView(PriceGuess guess, AuthorProfile profile, long cooldownMs) {
        int karma = profile == null ? 0 : profile.karma();
        return GuessView.builder()
                .id(guess.getId())
                .propertyId(guess.getPropertyId())
                .userId(guess.getUserId())
                .guessedPrice(guess.getGuessedPrice())
                .outlier(guess.isOutlier())
                .createdAtEpochMs(guess.getCreatedAtEpochMs())
                .updatedAtEpochMs(guess.getUpdatedAtEpochMs())
                .editableAtEpochMs(guess.getUpdatedAtEpochMs() + cooldownMs)
                .author(GuessView.Author.builder()
                        .id(guess.getUserId())
                        .username(profile == null ? null : profile.username())
                        .displayName(profile == null ? null : profile.displayName())
                        .karma(karma)
                        .rank(karmaRankResolver.resolve(karma))
                        .build())
                .build();
    }
}
