package com.smarttodo.entity;

import com.smarttodo.enums.EntryType;
import com.smarttodo.enums.Sentiment;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A raw piece of personal context (email, note, meeting minutes...) plus the signals
 * extracted from it. The extracted fields are owned by the analysis job and replaced
 * wholesale on every run.
 */
@Entity
@Table(name = "context_entries", indexes = {
        @Index(name = "idx_context_user_date", columnList = "user_id, entry_date"),
        @Index(name = "idx_context_type", columnList = "entry_type")
})
@Getter
@Setter
@NoArgsConstructor
public class ContextEntry {

    public static final double DEFAULT_IMPORTANCE = 0.5;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 20)
    private EntryType entryType;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(length = 200)
    private String source = "";

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "importance_score")
    private double importanceScore = DEFAULT_IMPORTANCE;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Sentiment sentiment;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> keywords = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_tasks")
    private List<String> extractedTasks = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_deadlines")
    private List<String> extractedDeadlines = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_people")
    private List<String> extractedPeople = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;
}
