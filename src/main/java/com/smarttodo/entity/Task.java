package com.smarttodo.entity;

import com.smarttodo.enums.Priorities;
import com.smarttodo.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_user_status", columnList = "user_id, status"),
        @Index(name = "idx_tasks_priority_deadline", columnList = "priority, deadline")
})
@Getter
@Setter
@NoArgsConstructor
public class Task {

    public static final int TITLE_MAX_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description = "";

    @Column(nullable = false)
    private int priority = Priorities.LOW;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status = TaskStatus.PENDING;

    private LocalDateTime deadline;

    // stamped from the application Clock by the services, like completedAt
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "ai_suggested_priority")
    private Integer aiSuggestedPriority;

    @Column(name = "ai_suggested_deadline")
    private LocalDateTime aiSuggestedDeadline;

    @Column(name = "ai_reasoning", columnDefinition = "TEXT")
    private String aiReasoning = "";

    @Column(name = "ai_enhanced_description", columnDefinition = "TEXT")
    private String aiEnhancedDescription = "";

    @ManyToMany
    @JoinTable(name = "task_categories",
            joinColumns = @JoinColumn(name = "task_id"),
            inverseJoinColumns = @JoinColumn(name = "category_id"))
    private Set<TaskCategory> categories = new HashSet<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context_tags")
    private List<String> contextTags = new ArrayList<>();

    @Column(name = "estimated_duration")
    private Duration estimatedDuration;

    @Column(name = "actual_duration")
    private Duration actualDuration;

    @Version
    private Long version;

    public boolean isActive() {
        return TaskStatus.ACTIVE.contains(status);
    }

    public boolean isOverdue(LocalDateTime now) {
        return deadline != null && status != TaskStatus.COMPLETED && now.isAfter(deadline);
    }

    /**
     * Moves the task to {@code newStatus}, stamping {@code completedAt} with {@code now} when it
     * becomes completed. Re-completing keeps the first completion time.
     */
    public void changeStatus(TaskStatus newStatus, LocalDateTime now) {
        if (newStatus != TaskStatus.COMPLETED) {
            completedAt = null;
        } else if (completedAt == null) {
            completedAt = now;
        }
        status = newStatus;
    }

    /**
     * completedAt is cleared whenever the task is not completed.
     */
    @PrePersist
    @PreUpdate
    void clearStaleCompletedAt() {
        if (status != TaskStatus.COMPLETED) {
            completedAt = null;
        }
    }
}
