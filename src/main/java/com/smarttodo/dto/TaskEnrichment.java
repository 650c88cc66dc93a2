package com.smarttodo.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Validated output of task enrichment. {@code deadline} is null when the model gave none
 * or gave one that did not parse.
 */
public record TaskEnrichment(
        String title,
        String enhancedDescription,
        int priority,
        LocalDateTime deadline,
        List<String> suggestedCategories,
        List<String> contextTags,
        String reasoning) {

    public TaskEnrichment {
        suggestedCategories = List.copyOf(suggestedCategories);
        contextTags = List.copyOf(contextTags);
    }
}
