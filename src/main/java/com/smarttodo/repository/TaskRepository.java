package com.smarttodo.repository;

import com.smarttodo.entity.Task;
import com.smarttodo.enums.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TaskRepository extends JpaRepository<Task, UUID> {

    Optional<Task> findByIdAndUserId(UUID id, Long userId);

    List<Task> findByUserIdOrderByCreatedAtDesc(Long userId);

    List<Task> findTop5ByUserIdOrderByCreatedAtDesc(Long userId);

    List<Task> findByUserIdAndStatusInOrderByPriorityAscCreatedAtAsc(Long userId, Collection<TaskStatus> statuses);

    long countByUserId(Long userId);

    long countByUserIdAndStatus(Long userId, TaskStatus status);

    long countByUserIdAndStatusIn(Long userId, Collection<TaskStatus> statuses);

    long countByUserIdAndStatusInAndPriority(Long userId, Collection<TaskStatus> statuses, int priority);

    long countByUserIdAndStatusInAndDeadlineBetween(Long userId, Collection<TaskStatus> statuses,
            LocalDateTime from, LocalDateTime to);

    long countByUserIdAndStatusInAndDeadlineBefore(Long userId, Collection<TaskStatus> statuses,
            LocalDateTime before);

    List<Task> findByUserIdAndStatusAndCompletedAtIsNotNull(Long userId, TaskStatus status);

    // rows of [category name, task count]; categories without tasks never join
    @Query("SELECT c.name, COUNT(t) FROM Task t JOIN t.categories c GROUP BY c.id, c.name ORDER BY COUNT(t) DESC, c.name ASC")
    List<Object[]> countTopCategories(Pageable pageable);
}
