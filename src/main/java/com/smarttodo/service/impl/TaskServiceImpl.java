package com.smarttodo.service.impl;

import com.smarttodo.dto.TaskDraft;
import com.smarttodo.dto.TaskStatsDTO;
import com.smarttodo.dto.TaskSummaryDTO;
import com.smarttodo.dto.TaskUpdate;
import com.smarttodo.entity.Task;
import com.smarttodo.enums.Priorities;
import com.smarttodo.enums.TaskStatus;
import com.smarttodo.event.TaskEnrichmentRequestedEvent;
import com.smarttodo.exception.ResourceNotFoundException;
import com.smarttodo.repository.TaskRepository;
import com.smarttodo.service.TaskCategoryService;
import com.smarttodo.service.TaskService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskServiceImpl implements TaskService {

    private final TaskRepository taskRepository;
    private final TaskCategoryService categoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public Task createTask(Long userId, TaskDraft draft) {
        if (draft.getTitle() == null || draft.getTitle().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        checkedTitleLength(draft.getTitle().strip());
        Task task = new Task();
        task.setUserId(userId);
        task.setCreatedAt(LocalDateTime.now(clock));
        task.setTitle(draft.getTitle().strip());
        task.setDescription(draft.getDescription() == null ? "" : draft.getDescription());
        task.setPriority(checkedPriority(draft.getPriority() == null ? Priorities.LOW : draft.getPriority()));
        task.setDeadline(draft.getDeadline());
        task.setEstimatedDuration(draft.getEstimatedDuration());
        if (draft.getContextTags() != null) {
            task.setContextTags(new ArrayList<>(draft.getContextTags()));
        }
        if (draft.getCategoryNames() != null) {
            task.getCategories().addAll(categoryService.getOrCreateAll(draft.getCategoryNames()));
        }

        Task saved = taskRepository.save(task);
        log.info("Created task {} for user {} (ai={})", saved.getId(), userId, draft.isUseAi());

        if (draft.isUseAi()) {
            eventPublisher.publishEvent(new TaskEnrichmentRequestedEvent(this, saved.getId()));
        }
        return saved;
    }

    @Override
    @Transactional
    public Task updateTask(Long userId, UUID taskId, TaskUpdate update) {
        Task task = getTask(userId, taskId);
        if (update.getTitle() != null) {
            task.setTitle(checkedTitleLength(update.getTitle().strip()));
        }
        if (update.getDescription() != null) {
            task.setDescription(update.getDescription());
        }
        if (update.getPriority() != null) {
            task.setPriority(checkedPriority(update.getPriority()));
        }
        if (update.getStatus() != null) {
            task.changeStatus(update.getStatus(), LocalDateTime.now(clock));
        }
        if (update.getDeadline() != null) {
            task.setDeadline(update.getDeadline());
        }
        if (update.getEstimatedDuration() != null) {
            task.setEstimatedDuration(update.getEstimatedDuration());
        }
        if (update.getActualDuration() != null) {
            task.setActualDuration(update.getActualDuration());
        }
        return taskRepository.saveAndFlush(task);
    }

    @Override
    @Transactional(readOnly = true)
    public Task getTask(Long userId, UUID taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> listTasks(Long userId) {
        return taskRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public TaskSummaryDTO summary(Long userId) {
        return new TaskSummaryDTO(userId, stats(userId), taskRepository.findTop5ByUserIdOrderByCreatedAtDesc(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public TaskStatsDTO stats(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);

        long total = taskRepository.countByUserId(userId);
        long completed = taskRepository.countByUserIdAndStatus(userId, TaskStatus.COMPLETED);
        long pending = taskRepository.countByUserIdAndStatus(userId, TaskStatus.PENDING);
        long inProgress = taskRepository.countByUserIdAndStatus(userId, TaskStatus.IN_PROGRESS);
        long highPriority = taskRepository.countByUserIdAndStatusInAndPriority(userId, TaskStatus.ACTIVE,
                Priorities.HIGH);
        long overdue = taskRepository.countByUserIdAndStatusInAndDeadlineBefore(userId, TaskStatus.ACTIVE, now);

        double completionRate = total > 0 ? round2(completed * 100.0 / total) : 0.0;

        List<Task> done = taskRepository.findByUserIdAndStatusAndCompletedAtIsNotNull(userId, TaskStatus.COMPLETED);
        double avgHours = 0.0;
        if (!done.isEmpty()) {
            double totalHours = 0.0;
            for (Task task : done) {
                totalHours += Duration.between(task.getCreatedAt(), task.getCompletedAt()).toSeconds() / 3600.0;
            }
            avgHours = round2(totalHours / done.size());
        }

        return new TaskStatsDTO(total, completed, pending, inProgress, highPriority, overdue, completionRate, avgHours);
    }

    private static String checkedTitleLength(String title) {
        if (title.length() > Task.TITLE_MAX_LENGTH) {
            throw new IllegalArgumentException("Task title must be at most " + Task.TITLE_MAX_LENGTH + " characters");
        }
        return title;
    }

    private static int checkedPriority(int priority) {
        if (!Priorities.isValid(priority)) {
            throw new IllegalArgumentException("Priority must be 1, 2 or 3 but was " + priority);
        }
        return priority;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
