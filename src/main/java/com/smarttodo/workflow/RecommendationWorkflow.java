package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarttodo.ai.IsoTimestamps;
import com.smarttodo.ai.PayloadReader;
import com.smarttodo.ai.ReasoningClient;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.ai.ReasoningRequest;
import com.smarttodo.dto.ContextSnippet;
import com.smarttodo.dto.RecommendationCandidate;
import com.smarttodo.entity.TaskCategory;
import com.smarttodo.entity.TaskRecommendation;
import com.smarttodo.enums.Priorities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Proposes new tasks from recent context. Avoiding titles the user already has is left to
 * the model; candidates are not filtered against existing tasks here.
 */
@Slf4j
@Component
public class RecommendationWorkflow extends ReasoningWorkflow {

    public static final double DEFAULT_CONFIDENCE = 0.75;

    static final double TEMPERATURE = 0.5;
    static final int MAX_TOKENS = 1200;

    private static final String INSTRUCTION = """
            You are a proactive assistant. You read a person's recent communications and their current
            to-do list and anticipate what they will need to do next. Never suggest a task that is
            already on their list.
            """;

    private static final String PROMPT = """
            Suggest new tasks for this user.

            Recent context:
            %s

            Titles of tasks already on the list (do not duplicate these):
            %s

            Return a JSON object with a single key "recommendations" holding an array. Each element has:
            - "title": the suggested task title.
            - "description": why this task is needed, in detail.
            - "priority": integer 1-3 (1 = High, 3 = Low).
            - "deadline": ISO 8601 timestamp if the context implies one, otherwise null.
            - "reasoning": short explanation of the recommendation.
            - "confidence_score": number between 0.0 and 1.0.
            - "suggested_categories": array of category names.
            - "context_entry_ids": array of the "id" values of the context entries this is based on.
            Return an empty array when nothing new is worth suggesting.
            """;

    public RecommendationWorkflow(ReasoningClientFactory clientFactory, ObjectMapper objectMapper, Clock clock) {
        super(clientFactory, objectMapper, clock);
    }

    public List<RecommendationCandidate> recommend(Long userId, List<ContextSnippet> recentContext,
            List<String> activeTaskTitles) {
        ReasoningClient client = clientFor(userId, "recommendations:user:" + userId);
        ReasoningRequest request = new ReasoningRequest(INSTRUCTION,
                buildPrompt(recentContext, activeTaskTitles), TEMPERATURE, MAX_TOKENS);

        Set<UUID> knownEntryIds = recentContext.stream()
                .map(ContextSnippet::id)
                .collect(Collectors.toSet());

        return client.request(request).fold(
                payload -> fromPayload(payload, knownEntryIds, client.getEntityRef()),
                failure -> List.of());
    }

    List<RecommendationCandidate> fromPayload(ObjectNode payload, Set<UUID> knownEntryIds, String entityRef) {
        List<RecommendationCandidate> candidates = new ArrayList<>();
        for (JsonNode item : PayloadReader.of(payload).objects("recommendations")) {
            PayloadReader reader = PayloadReader.of(item);
            String title = reader.nonBlankText("title").orElse(null);
            if (title == null) {
                log.warn("Skipping recommendation without a title for {}: {}", entityRef, item);
                continue;
            }
            if (title.length() > TaskRecommendation.TITLE_MAX_LENGTH) {
                log.warn("Truncating recommendation title of {} characters for {}", title.length(), entityRef);
                title = title.substring(0, TaskRecommendation.TITLE_MAX_LENGTH).strip();
            }
            candidates.add(new RecommendationCandidate(
                    title,
                    reader.text("description").orElse(""),
                    reader.priority("priority").orElse(Priorities.LOW),
                    reader.nonBlankText("deadline").flatMap(raw -> IsoTimestamps.parse(raw, zone)).orElse(null),
                    reader.text("reasoning").orElse(""),
                    reader.score("confidence_score").orElse(DEFAULT_CONFIDENCE),
                    withinLength(reader.strings("suggested_categories"), TaskCategory.NAME_MAX_LENGTH,
                            "category name", entityRef),
                    knownIds(reader.strings("context_entry_ids"), knownEntryIds)));
        }
        return candidates;
    }

    private static Set<UUID> knownIds(List<String> rawIds, Set<UUID> knownEntryIds) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (String raw : rawIds) {
            UUID id = Uuids.parse(raw);
            if (id != null && knownEntryIds.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private String buildPrompt(List<ContextSnippet> recentContext, List<String> activeTaskTitles) {
        List<Map<String, Object>> context = new ArrayList<>(recentContext.size());
        for (ContextSnippet snippet : recentContext) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", String.valueOf(snippet.id()));
            item.put("entry_type", snippet.entryType());
            item.put("entry_date", String.valueOf(snippet.entryDate()));
            item.put("content", snippet.content());
            context.add(item);
        }
        return PROMPT.formatted(toJson(context), toJson(activeTaskTitles));
    }
}
