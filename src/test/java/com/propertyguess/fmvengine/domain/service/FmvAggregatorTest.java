package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.FmvConfidence;
import com.propertyguess.fmvengine.domain.model.FmvDistribution;
import com.propertyguess.fmvengine.domain.model.FmvResult;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import com.propertyguess.fmvengine.domain.service.fmv.AnchoringPolicy;
import com.propertyguess.fmvengine.domain.service.fmv.KarmaWeightedEstimator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FmvAggregator")
class FmvAggregatorTest {

    private static final UUID PROPERTY_ID = UUID.randomUUID();

    @Mock
    private PropertyLookup propertyLookup;

    @Mock
    private PriceGuessRepository priceGuessRepository;

    @Mock
    private UserKarmaLookup userKarmaLookup;

    private FmvAggregator aggregator;
    private final Map<UUID, Integer> karma = new HashMap<>();
    private long clock = 1_700_000_000_000L;

    @BeforeEach
    void setUp() {
        FmvProperties properties = new FmvProperties();
        KarmaRankResolver rankResolver = new KarmaRankResolver();
        aggregator = new FmvAggregator(
                propertyLookup,
                priceGuessRepository,
                userKarmaLookup,
                new KarmaWeightedEstimator(rankResolver, properties),
                new AnchoringPolicy(properties),
                new SimpleMeterRegistry());
        aggregator.initMetrics();
    }

    @Nested
    @DisplayName("compute()")
    class Compute {

        @Test
        @DisplayName("unknown property fails with NOT_FOUND")
        void unknownProperty() {
            when(propertyLookup.exists(PROPERTY_ID)).thenReturn(false);

            assertThatThrownBy(() -> aggregator.compute(PROPERTY_ID))
                    .isInstanceOf(FmvEngineException.class)
                    .extracting(e -> ((FmvEngineException) e).getKind())
                    .isEqualTo(FmvEngineException.FailureKind.NOT_FOUND);
            verify(priceGuessRepository, never()).findByPropertyId(PROPERTY_ID);
        }

        @Test
        @DisplayName("zero guesses → confidence none, no value, no distribution, no error")
        void zeroGuesses() {
            stubProperty(new PropertyReference(new BigDecimal("300000"), new BigDecimal("325000")));
            when(priceGuessRepository.findByPropertyId(PROPERTY_ID)).thenReturn(List.of());

            FmvResult result = aggregator.compute(PROPERTY_ID);

            assertThat(result.getValue()).isNull();
            assertThat(result.getConfidence()).isEqualTo(FmvConfidence.NONE);
            assertThat(result.getDistribution()).isNull();
            assertThat(result.getDivergence()).isNull();
            assertThat(result.getGuessCount()).isZero();
            assertThat(result.getAssessedValue()).isEqualByComparingTo("300000");
            assertThat(result.getAskingPrice()).isEqualByComparingTo("325000");
        }

        @Test
        @DisplayName("single €500,000 guess on a €300,000 assessment is anchored toward the assessment")
        void singleGuessIsAnchored() {
            stubProperty(new PropertyReference(new BigDecimal("300000"), null));
            stubGuesses(List.of(guess("500000", 40, false)));

            FmvResult result = aggregator.compute(PROPERTY_ID);

            assertThat(result.getConfidence()).isEqualTo(FmvConfidence.LOW);
            assertThat(result.isAnchored()).isTrue();
            assertThat(result.getValue()).isEqualByComparingTo("400000");
            assertThat(result.getDivergence()).isNull();
        }

        @Test
        @DisplayName("twelve guesses between €350k and €520k → high confidence, no anchoring")
        void twelveGuessesHighConfidence() {
            stubProperty(new PropertyReference(new BigDecimal("300000"), null));
            List<PriceGuess> guesses = new ArrayList<>();
            String[] prices = {"350000", "360000", "375000", "390000", "400000", "410000",
                    "425000", "440000", "455000", "470000", "495000", "520000"};
            for (int i = 0; i < prices.length; i++) {
                guesses.add(guess(prices[i], i * 60, false));
            }
            stubGuesses(guesses);

            FmvResult result = aggregator.compute(PROPERTY_ID);
            FmvDistribution d = result.getDistribution();

            assertThat(result.getConfidence()).isEqualTo(FmvConfidence.HIGH);
            assertThat(result.isAnchored()).isFalse();
            assertThat(result.getGuessCount()).isEqualTo(12);
            assertThat(d.min()).isEqualByComparingTo("350000");
            assertThat(d.max()).isEqualByComparingTo("520000");
            assertThat(d.p50()).isGreaterThan(d.min()).isLessThan(d.max());
            assertThat(result.getValue()).isBetween(new BigDecimal("350000"), new BigDecimal("520000"));
        }

        @Test
        @DisplayName("a €1 meme guess is still counted in the distribution and the estimate")
        void memeGuessStillCounts() {
            stubProperty(new PropertyReference(new BigDecimal("400000"), null));
            stubGuesses(List.of(
                    guess("1", 0, true),
                    guess("390000", 0, false),
                    guess("410000", 0, false)));

            FmvResult result = aggregator.compute(PROPERTY_ID);

            assertThat(result.getGuessCount()).isEqualTo(3);
            assertThat(result.getDistribution().min()).isEqualByComparingTo("1");
            // (1 + 390000 + 410000) / 3
            assertThat(result.getValue()).isEqualByComparingTo("266667.00");
        }

        @Test
        @DisplayName("divergence is the asking price's signed distance from the estimate, in percent")
        void divergenceAgainstAskingPrice() {
            stubProperty(new PropertyReference(null, new BigDecimal("420000")));
            stubGuesses(List.of(
                    guess("380000", 0, false),
                    guess("400000", 0, false),
                    guess("420000", 0, false)));

            FmvResult result = aggregator.compute(PROPERTY_ID);

            assertThat(result.getValue()).isEqualByComparingTo("400000");
            assertThat(result.getDivergence()).isEqualByComparingTo("5.00");
        }

        @Test
        @DisplayName("without any karma data the median is the point estimate")
        void medianFallback() {
            stubProperty(PropertyReference.EMPTY);
            List<PriceGuess> guesses = List.of(
                    guessBy(UUID.randomUUID(), "100000"),
                    guessBy(UUID.randomUUID(), "200000"),
                    guessBy(UUID.randomUUID(), "900000"));
            when(priceGuessRepository.findByPropertyId(PROPERTY_ID)).thenReturn(guesses);
            when(userKarmaLookup.getKarmaByUser(anyCollection())).thenReturn(Map.of());

            FmvResult result = aggregator.compute(PROPERTY_ID);

            assertThat(result.getValue()).isEqualByComparingTo("200000");
        }

        @Test
        @DisplayName("computing twice without writes yields identical results")
        void idempotent() {
            stubProperty(new PropertyReference(new BigDecimal("300000"), new BigDecimal("350000")));
            stubGuesses(List.of(
                    guess("310000", 12, false),
                    guess("330000", 150, false),
                    guess("1", 0, true),
                    guess("365000", 800, false)));

            FmvResult first = aggregator.compute(PROPERTY_ID);
            FmvResult second = aggregator.compute(PROPERTY_ID);

            assertThat(second).isEqualTo(first);
        }
    }

    @Test
    @DisplayName("missing or non-positive asking price leaves divergence empty")
    void divergenceNeedsPositiveAskingPrice() {
        BigDecimal value = new BigDecimal("400000.00");

        assertThat(FmvAggregator.divergence(new PropertyReference(null, BigDecimal.ZERO), value)).isNull();
        assertThat(FmvAggregator.divergence(PropertyReference.EMPTY, value)).isNull();
        assertThat(FmvAggregator.divergence(new PropertyReference(null, new BigDecimal("380000")), value))
                .isEqualByComparingTo("-5.00");
    }

    private void stubProperty(PropertyReference reference) {
        when(propertyLookup.exists(PROPERTY_ID)).thenReturn(true);
        when(propertyLookup.getReference(PROPERTY_ID)).thenReturn(reference);
    }

    private void stubGuesses(List<PriceGuess> guesses) {
        when(priceGuessRepository.findByPropertyId(PROPERTY_ID)).thenReturn(guesses);
        when(userKarmaLookup.getKarmaByUser(anyCollection())).thenReturn(karma);
    }

    private PriceGuess guess(String price, int authorKarma, boolean outlier) {
        UUID userId = UUID.randomUUID();
        karma.put(userId, authorKarma);
        PriceGuess guess = guessBy(userId, price);
        guess.setOutlier(outlier);
        return guess;
    }

    private PriceGuess guessBy(UUID userId, String price) {
        clock += 1_000;
        return PriceGuess.builder()
                .id(UUID.randomUUID())
                .propertyId(PROPERTY_ID)
                .userId(userId)
                .guessedPrice(new BigDecimal(price))
                .createdAtEpochMs(clock)
                .updatedAtEpochMs(clock)
                .build();
    }
}
