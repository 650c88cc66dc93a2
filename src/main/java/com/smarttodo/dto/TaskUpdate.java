package com.smarttodo.dto;

import com.smarttodo.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Partial task update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskUpdate {
    private String title;
    private String description;
    private Integer priority;
    private TaskStatus status;
    private LocalDateTime deadline;
    private Duration estimatedDuration;
    private Duration actualDuration;
}
