package com.smarttodo.dto;

/**
 * Counts over the owner's active (pending / in progress) tasks.
 */
public record WorkloadSummary(long total, long highPriority, long dueWithinWeek) {
}
