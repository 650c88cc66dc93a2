package com.smarttodo.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarttodo.ai.ReasoningResult.Failure;
import com.smarttodo.ai.ReasoningResult.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

import java.util.List;

/**
 * Calls the chat model once and turns whatever comes back into a {@link ReasoningResult}.
 * <p>
 * Instances are cheap and bound to one job: the owning user and the entity being worked on
 * are carried along only so failures can be logged against them. Nothing is thrown past
 * {@link #request(ReasoningRequest)}; callers decide their own fallback.
 */
@Slf4j
public final class ReasoningClient {

    static final ResponseFormat JSON_OBJECT = ResponseFormat.builder()
            .type(ResponseFormat.Type.JSON_OBJECT)
            .build();

    static final String JSON_ONLY_RULE =
            "Respond with a single valid JSON object only. No markdown, no prose outside the JSON.";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Long userId;
    private final String entityRef;

    ReasoningClient(ChatModel chatModel, ObjectMapper objectMapper, String model, Long userId, String entityRef) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.model = model;
        this.userId = userId;
        this.entityRef = entityRef;
    }

    public Long getUserId() {
        return userId;
    }

    public String getEntityRef() {
        return entityRef;
    }

    public ReasoningResult request(ReasoningRequest request) {
        String raw;
        try {
            raw = extractText(chatModel.call(toPrompt(request)));
        } catch (RuntimeException e) {
            log.debug("Reasoning transport failure for user {} ({})", userId, entityRef, e);
            return fail(FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (raw == null || raw.isBlank()) {
            return fail(FailureKind.EMPTY_RESPONSE, "model returned no content");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            return fail(FailureKind.MALFORMED_RESPONSE, "not JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            return fail(FailureKind.MALFORMED_RESPONSE,
                    "expected a JSON object, got " + (node == null ? "nothing" : node.getNodeType()));
        }
        return new ReasoningResult.Success((ObjectNode) node);
    }

    Prompt toPrompt(ReasoningRequest request) {
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .responseFormat(JSON_OBJECT);
        if (model != null && !model.isBlank()) {
            options.model(model);
        }
        String instruction = request.instruction().strip() + "\n" + JSON_ONLY_RULE;
        return new Prompt(
                List.of(new SystemMessage(instruction), new UserMessage(request.prompt())),
                options.build());
    }

    private Failure fail(FailureKind kind, String detail) {
        log.warn("Reasoning request failed for user {} ({}): {} - {}", userId, entityRef, kind, detail);
        return new Failure(kind, detail);
    }

    private static String extractText(ChatResponse response) {
        if (response == null) {
            return null;
        }
        Generation generation = response.getResult();
        if (generation == null || generation.getOutput() == null) {
            return null;
        }
        return generation.getOutput().getText();
    }

    /**
     * Models sometimes wrap the object in a ```json fence despite being told not to.
     */
    static String stripCodeFence(String raw) {
        String text = raw.strip();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).strip();
    }
}
