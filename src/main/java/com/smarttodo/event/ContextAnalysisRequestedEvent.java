package com.smarttodo.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

public class ContextAnalysisRequestedEvent extends ApplicationEvent {
    private final UUID entryId;

    public ContextAnalysisRequestedEvent(Object source, UUID entryId) {
        super(source);
        this.entryId = entryId;
    }

    public UUID getEntryId() {
        return entryId;
    }
}
