package com.smarttodo.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDraft {
    private String title;
    private String description;
    private Integer priority;
    private LocalDateTime deadline;
    private Duration estimatedDuration;
    @Builder.Default
    private List<String> contextTags = new ArrayList<>();
    @Builder.Default
    private List<String> categoryNames = new ArrayList<>();
    // false skips the background enrichment job
    @Builder.Default
    private boolean useAi = true;
}
