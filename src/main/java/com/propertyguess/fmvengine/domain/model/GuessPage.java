package com.propertyguess.fmvengine.domain.model;

import java.util.List;

public record GuessPage(
        List<GuessView> guesses,
        int page,
        int pageSize,
        long total,
        int totalPages,
        FmvResult fmv
) {
}
