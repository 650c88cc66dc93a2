package com.smarttodo.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "time_block_suggestions", indexes = {
        @Index(name = "idx_time_block_user_start", columnList = "user_id, suggested_start_time")
})
@Getter
@Setter
@NoArgsConstructor
public class TimeBlockSuggestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    @Column(name = "suggested_start_time", nullable = false)
    private LocalDateTime suggestedStartTime;

    @Column(name = "suggested_end_time", nullable = false)
    private LocalDateTime suggestedEndTime;

    @Column(columnDefinition = "TEXT")
    private String reasoning = "";

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
