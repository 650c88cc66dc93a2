package com.smarttodo.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record RecommendationCandidate(
        String title,
        String description,
        int priority,
        LocalDateTime deadline,
        String reasoning,
        double confidenceScore,
        List<String> suggestedCategories,
        Set<UUID> contextEntryIds) {

    public RecommendationCandidate {
        suggestedCategories = List.copyOf(suggestedCategories);
        contextEntryIds = Set.copyOf(contextEntryIds);
    }
}
