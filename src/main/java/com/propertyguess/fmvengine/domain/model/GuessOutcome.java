package com.propertyguess.fmvengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a past guess compares with the price the property actually sold for.
 */
public enum GuessOutcome {
    PENDING, ACCURATE, CLOSE, INACCURATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
