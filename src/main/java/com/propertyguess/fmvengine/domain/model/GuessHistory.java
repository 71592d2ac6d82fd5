package com.propertyguess.fmvengine.domain.model;

import java.util.List;

public record GuessHistory(
        List<GuessHistoryItem> items,
        int page,
        int pageSize,
        long total,
        boolean hasMore
) {
}
