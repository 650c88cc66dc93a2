package com.smarttodo.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published once a task write has committed; only the id travels, the job reloads the task.
 */
public class TaskEnrichmentRequestedEvent extends ApplicationEvent {
    private final UUID taskId;

    public TaskEnrichmentRequestedEvent(Object source, UUID taskId) {
        super(source);
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}
