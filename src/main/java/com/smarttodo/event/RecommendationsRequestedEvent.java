package com.smarttodo.event;

import org.springframework.context.ApplicationEvent;

public class RecommendationsRequestedEvent extends ApplicationEvent {
    private final Long userId;

    public RecommendationsRequestedEvent(Object source, Long userId) {
        super(source);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
