package com.smarttodo.service;

import com.smarttodo.dto.TaskDraft;
import com.smarttodo.dto.TaskStatsDTO;
import com.smarttodo.dto.TaskSummaryDTO;
import com.smarttodo.dto.TaskUpdate;
import com.smarttodo.entity.Task;

import java.util.List;
import java.util.UUID;

public interface TaskService {

    /**
     * Stores a new task and, unless {@link TaskDraft#isUseAi()} is false, queues its
     * enrichment to run after the insert commits.
     */
    Task createTask(Long userId, TaskDraft draft);

    Task updateTask(Long userId, UUID taskId, TaskUpdate update);

    Task getTask(Long userId, UUID taskId);

    List<Task> listTasks(Long userId);

    TaskStatsDTO stats(Long userId);

    /**
     * {@link #stats(Long)} together with the user's five newest tasks.
     */
    TaskSummaryDTO summary(Long userId);
}
