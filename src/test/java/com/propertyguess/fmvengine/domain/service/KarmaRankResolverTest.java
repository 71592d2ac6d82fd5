package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.KarmaRank;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KarmaRankResolver")
class KarmaRankResolverTest {

    private final KarmaRankResolver resolver = new KarmaRankResolver();

    @ParameterizedTest(name = "karma {0} → {1} (level {2})")
    @CsvSource({
            "0, Newbie, 1",
            "10, Newbie, 1",
            "11, Regular, 2",
            "50, Regular, 2",
            "51, Trusted, 3",
            "100, Trusted, 3",
            "101, Expert, 4",
            "499, Expert, 4",
            "500, Legend, 5",
            "1000000, Legend, 5"
    })
    void tierBoundariesAreInclusiveLowerBounds(int karma, String title, int level) {
        KarmaRank rank = resolver.resolve(karma);

        assertThat(rank.title()).isEqualTo(title);
        assertThat(rank.level()).isEqualTo(level);
    }

    @Test
    @DisplayName("negative karma is clamped to the lowest tier instead of rejected")
    void negativeKarmaClampsToNewbie() {
        assertThat(resolver.resolve(-1)).isEqualTo(KarmaRank.NEWBIE);
        assertThat(resolver.resolve(Integer.MIN_VALUE)).isEqualTo(KarmaRank.NEWBIE);
    }

    @Test
    @DisplayName("unknown karma resolves as zero")
    void nullKarmaResolvesAsZero() {
        assertThat(resolver.resolve((Integer) null)).isEqualTo(KarmaRank.NEWBIE);
    }

    @Test
    @DisplayName("levels increase monotonically with karma")
    void levelsAreMonotonic() {
        int previous = 0;
        for (int karma = -5; karma <= 700; karma++) {
            int level = resolver.resolve(karma).level();
            assertThat(level).isGreaterThanOrEqualTo(previous);
            previous = level;
        }
    }
}
