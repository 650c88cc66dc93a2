package com.smarttodo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Statuses that count towards the workload and can be scheduled. */
    public static final Set<TaskStatus> ACTIVE = EnumSet.of(PENDING, IN_PROGRESS);
}
