package com.smarttodo.dto;

import com.smarttodo.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dashboard view of one user: their task statistics plus the newest tasks.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskSummaryDTO {
    private Long userId;
    private TaskStatsDTO stats;
    private List<Task> recentTasks;
}
