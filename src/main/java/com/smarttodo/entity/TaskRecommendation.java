package com.smarttodo.entity;

import com.smarttodo.enums.Priorities;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "task_recommendations")
@Getter
@Setter
@NoArgsConstructor
public class TaskRecommendation {

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

    @Column(name = "suggested_priority", nullable = false)
    private int suggestedPriority = Priorities.LOW;

    @Column(name = "suggested_deadline")
    private LocalDateTime suggestedDeadline;

    @Column(columnDefinition = "TEXT")
    private String reasoning = "";

    @Column(name = "confidence_score")
    private double confidenceScore;

    @ManyToMany
    @JoinTable(name = "task_recommendation_context",
            joinColumns = @JoinColumn(name = "recommendation_id"),
            inverseJoinColumns = @JoinColumn(name = "context_entry_id"))
    private Set<ContextEntry> basedOnContext = new HashSet<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "suggested_categories")
    private List<String> suggestedCategories = new ArrayList<>();

    @Column(name = "is_accepted")
    private boolean accepted;

    @Column(name = "is_dismissed")
    private boolean dismissed;

    @ManyToOne
    @JoinColumn(name = "created_task_id")
    private Task createdTask;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
