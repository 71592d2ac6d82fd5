package com.propertyguess.fmvengine.domain.exception;

import java.time.Instant;
import java.util.UUID;

/**
 * Typed failure surfaced to callers of the guess gate and the aggregator. Never retried internally.
 */
public class FmvEngineException extends RuntimeException {

    private final FailureKind kind;
    private final Instant cooldownEndsAt;

    public FmvEngineException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    private FmvEngineException(FailureKind kind, String message, Instant cooldownEndsAt) {
        super(message);
        this.kind = kind;
        this.cooldownEndsAt = cooldownEndsAt;
    }

    public static FmvEngineException propertyNotFound(UUID propertyId) {
        return new FmvEngineException(FailureKind.NOT_FOUND, "Property with ID " + propertyId + " not found");
    }

    public static FmvEngineException unauthorized() {
        return new FmvEngineException(FailureKind.UNAUTHORIZED, "Authentication is required to submit a guess");
    }

    public static FmvEngineException invalidInput(String message) {
        return new FmvEngineException(FailureKind.INVALID_INPUT, message);
    }

    public static FmvEngineException cooldownActive(Instant cooldownEndsAt) {
        return new FmvEngineException(FailureKind.COOLDOWN_ACTIVE,
                "You must wait before updating your guess.", cooldownEndsAt);
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Only set for {@link FailureKind#COOLDOWN_ACTIVE}.
     */
    public Instant getCooldownEndsAt() {
        return cooldownEndsAt;
    }

    public enum FailureKind {
        NOT_FOUND, UNAUTHORIZED, INVALID_INPUT, COOLDOWN_ACTIVE
    }
}
