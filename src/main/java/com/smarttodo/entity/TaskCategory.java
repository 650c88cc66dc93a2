package com.smarttodo.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "task_category")
@Getter
@Setter
@NoArgsConstructor
public class TaskCategory {

    public static final String DEFAULT_COLOR = "#3B82F6";
    public static final int NAME_MAX_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = NAME_MAX_LENGTH)
    private String name;

    @Column(length = 7)
    private String color = DEFAULT_COLOR;

    @Column(columnDefinition = "TEXT")
    private String description = "";

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public TaskCategory(String name) {
        this.name = name;
    }
}
