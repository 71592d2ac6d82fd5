package com.propertyguess.fmvengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FmvConfidence {
    NONE, LOW, MEDIUM, HIGH;

    public static FmvConfidence fromGuessCount(int guessCount) {
        if (guessCount <= 0) return NONE;
        if (guessCount <= 2) return LOW;
        if (guessCount <= 9) return MEDIUM;
        return HIGH;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
