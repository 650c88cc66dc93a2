package com.smarttodo.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link ReasoningClient} per workflow invocation so no client state
 * is shared between jobs.
 */
@Component
public class ReasoningClientFactory {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String model;

    public ReasoningClientFactory(ChatModel chatModel, ObjectMapper objectMapper,
            @Value("${smarttodo.ai.model:gpt-4o}") String model) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.model = model;
    }

    public ReasoningClient forJob(Long userId, String entityRef) {
        return new ReasoningClient(chatModel, objectMapper, model, userId, entityRef);
    }
}
