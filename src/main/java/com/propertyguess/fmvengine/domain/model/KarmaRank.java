package com.propertyguess.fmvengine.domain.model;

import java.util.List;

/**
 * Display tiers for a user's karma score, ordered from highest to lowest lower bound.
 */
public enum KarmaRank {

    LEGEND("Legend", 5, 500),
    EXPERT("Expert", 4, 101),
    TRUSTED("Trusted", 3, 51),
    REGULAR("Regular", 2, 11),
    NEWBIE("Newbie", 1, 0);

    private static final List<KarmaRank> DESCENDING = List.of(values());

    private final String title;
    private final int level;
    private final int minKarma;

    KarmaRank(String title, int level, int minKarma) {
        this.title = title;
        this.level = level;
        this.minKarma = minKarma;
    }

    public String title() {
        return title;
    }

    public int level() {
        return level;
    }

    public static KarmaRank findRank(int karma) {
        int clamped = Math.max(0, karma);
        for (KarmaRank rank : DESCENDING) {
            if (clamped >= rank.minKarma) {
                return rank;
            }
        }
        return NEWBIE;
    }
}
