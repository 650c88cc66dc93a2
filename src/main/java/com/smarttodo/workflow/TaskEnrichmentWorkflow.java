package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarttodo.ai.IsoTimestamps;
import com.smarttodo.ai.PayloadReader;
import com.smarttodo.ai.ReasoningClient;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.ai.ReasoningRequest;
import com.smarttodo.dto.ContextSnippet;
import com.smarttodo.dto.TaskEnrichment;
import com.smarttodo.dto.TaskInput;
import com.smarttodo.dto.WorkloadSummary;
import com.smarttodo.entity.Task;
import com.smarttodo.entity.TaskCategory;
import com.smarttodo.enums.Priorities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a freshly created task plus the owner's recent context and workload into an
 * enriched task. Always returns a complete {@link TaskEnrichment}; when the model call
 * fails the user's own values come back unchanged.
 */
@Slf4j
@Component
public class TaskEnrichmentWorkflow extends ReasoningWorkflow {

    public static final String FALLBACK_REASONING = "AI processing failed. Using user-provided details.";

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1024;

    private static final String INSTRUCTION = """
            You are a productivity assistant that turns rough to-do items into clear, well-prioritised tasks.
            Use the user's recent messages, emails, notes and meetings, their current workload and their
            preferences to decide priority, a realistic deadline, categories and tags.
            """;

    private static final String PROMPT = """
            Enrich the task below.

            Task:
            - Title: "%s"
            - Description: "%s"
            - Priority set by the user: %d (%s)

            Recent context, newest first:
            %s

            Current workload (active tasks):
            %s

            User preferences:
            %s

            Return a JSON object with these fields:
            1. "title": a clear, actionable, concise rewrite of the title.
            2. "enhanced_description": an improved description that folds in relevant details from the context.
            3. "priority": integer, 1 = High, 2 = Medium, 3 = Low, based on urgency, importance and context.
            4. "deadline": a realistic deadline as an ISO 8601 timestamp (YYYY-MM-DDTHH:MM:SS), or null if none applies.
            5. "suggested_categories": array of broad category names such as "Work", "Personal", "Finance".
            6. "context_tags": array of specific, granular tags taken from the task and the context.
            7. "reasoning": one or two sentences explaining the priority and deadline.
            """;

    public TaskEnrichmentWorkflow(ReasoningClientFactory clientFactory, ObjectMapper objectMapper, Clock clock) {
        super(clientFactory, objectMapper, clock);
    }

    public TaskEnrichment enrich(Long userId, UUID taskId, TaskInput task, List<ContextSnippet> recentContext,
            WorkloadSummary workload, Map<String, String> preferences) {
        ReasoningClient client = clientFor(userId, "task:" + taskId);
        ReasoningRequest request = new ReasoningRequest(INSTRUCTION,
                buildPrompt(task, recentContext, workload, preferences), TEMPERATURE, MAX_TOKENS);

        return client.request(request).fold(
                payload -> fromPayload(payload, task, client.getEntityRef()),
                failure -> fallback(task));
    }

    public static TaskEnrichment fallback(TaskInput task) {
        return new TaskEnrichment(task.title(), nullToEmpty(task.description()), task.priority(), null,
                List.of(), List.of(), FALLBACK_REASONING);
    }

    TaskEnrichment fromPayload(ObjectNode payload, TaskInput task, String entityRef) {
        PayloadReader reader = PayloadReader.of(payload);

        LocalDateTime deadline = null;
        Optional<String> rawDeadline = reader.nonBlankText("deadline");
        if (rawDeadline.isPresent()) {
            deadline = IsoTimestamps.parse(rawDeadline.get(), zone).orElse(null);
            if (deadline == null) {
                log.warn("Dropping unparseable deadline '{}' for {}", rawDeadline.get(), entityRef);
            }
        }

        return new TaskEnrichment(
                reader.nonBlankText("title")
                        .filter(title -> fits(title, Task.TITLE_MAX_LENGTH, "title", entityRef))
                        .orElse(task.title()),
                reader.text("enhanced_description").orElse(nullToEmpty(task.description())),
                reader.priority("priority").orElse(task.priority()),
                deadline,
                withinLength(reader.strings("suggested_categories"), TaskCategory.NAME_MAX_LENGTH,
                        "category name", entityRef),
                reader.strings("context_tags"),
                reader.text("reasoning").orElse(""));
    }

    private String buildPrompt(TaskInput task, List<ContextSnippet> recentContext, WorkloadSummary workload,
            Map<String, String> preferences) {
        List<Map<String, Object>> context = new ArrayList<>(recentContext.size());
        for (ContextSnippet snippet : recentContext) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("entry_type", snippet.entryType());
            item.put("entry_date", String.valueOf(snippet.entryDate()));
            item.put("content", snippet.content());
            context.add(item);
        }

        Map<String, Object> load = new LinkedHashMap<>();
        load.put("total", workload.total());
        load.put("high_priority", workload.highPriority());
        load.put("due_within_7_days", workload.dueWithinWeek());

        return PROMPT.formatted(
                task.title(),
                nullToEmpty(task.description()),
                task.priority(),
                Priorities.label(task.priority()),
                toJson(context),
                toJson(load),
                toJson(new LinkedHashMap<>(preferences)));
    }
}
