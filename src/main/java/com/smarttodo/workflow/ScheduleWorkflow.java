package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarttodo.ai.IsoTimestamps;
import com.smarttodo.ai.PayloadReader;
import com.smarttodo.ai.ReasoningClient;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.ai.ReasoningRequest;
import com.smarttodo.dto.CalendarEvent;
import com.smarttodo.dto.SchedulableTask;
import com.smarttodo.dto.TimeBlockCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Asks the model to lay out time blocks for the owner's open tasks on one day.
 * <p>
 * Overlap with the supplied events and priority ordering are the model's job. Here each
 * block is only checked on its own: the task must belong to the owner, both timestamps
 * must parse, start must precede end, and the block must start on the requested date.
 * A block failing any check is dropped and the rest are kept.
 */
@Slf4j
@Component
public class ScheduleWorkflow extends ReasoningWorkflow {

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1500;

    private static final String INSTRUCTION = """
            You are a time-blocking assistant. You plan a single working day by placing the user's open
            tasks into concrete time slots around the events already on their calendar.
            """;

    private static final String PROMPT = """
            Plan %s.

            Open tasks (priority 1 = High, 3 = Low; estimated_minutes may be null):
            %s

            Events already on the calendar that day (do not overlap them):
            %s

            Rules:
            - Schedule higher-priority tasks first and in better slots.
            - Blocks must not overlap each other or the existing events.
            - Use a sensible duration when estimated_minutes is null.
            - Skip tasks that do not fit in the day.

            Return a JSON object with a single key "schedule" holding an array. Each element has:
            - "task_id": the id of the task exactly as given above.
            - "suggested_start_time": ISO 8601 timestamp on %s.
            - "suggested_end_time": ISO 8601 timestamp after the start.
            - "reasoning": short explanation for the slot.
            """;

    public ScheduleWorkflow(ReasoningClientFactory clientFactory, ObjectMapper objectMapper, Clock clock) {
        super(clientFactory, objectMapper, clock);
    }

    /**
     * @param ownedByUser true for ids of tasks that exist and belong to {@code userId}
     */
    public List<TimeBlockCandidate> suggest(Long userId, LocalDate date, List<SchedulableTask> tasks,
            List<CalendarEvent> existingEvents, Predicate<UUID> ownedByUser) {
        ReasoningClient client = clientFor(userId, "schedule:user:" + userId + ":" + date);
        ReasoningRequest request = new ReasoningRequest(INSTRUCTION,
                buildPrompt(date, tasks, existingEvents), TEMPERATURE, MAX_TOKENS);

        return client.request(request).fold(
                payload -> fromPayload(payload, date, ownedByUser, client.getEntityRef()),
                failure -> List.of());
    }

    List<TimeBlockCandidate> fromPayload(ObjectNode payload, LocalDate date, Predicate<UUID> ownedByUser,
            String entityRef) {
        Set<TimeBlockCandidate> blocks = new LinkedHashSet<>();
        for (JsonNode item : PayloadReader.of(payload).objects("schedule")) {
            PayloadReader reader = PayloadReader.of(item);

            UUID taskId = Uuids.parse(reader.text("task_id").orElse(null));
            if (taskId == null || !ownedByUser.test(taskId)) {
                log.warn("Dropping time block for unknown or foreign task in {}: {}", entityRef, item);
                continue;
            }
            LocalDateTime start = reader.text("suggested_start_time")
                    .flatMap(raw -> IsoTimestamps.parse(raw, zone)).orElse(null);
            LocalDateTime end = reader.text("suggested_end_time")
                    .flatMap(raw -> IsoTimestamps.parse(raw, zone)).orElse(null);
            if (start == null || end == null) {
                log.warn("Dropping time block with unparseable timestamps in {}: {}", entityRef, item);
                continue;
            }
            if (!start.isBefore(end)) {
                log.warn("Dropping time block that does not end after it starts in {}: {}", entityRef, item);
                continue;
            }
            if (!start.toLocalDate().equals(date)) {
                log.warn("Dropping time block starting outside {} in {}: {}", date, entityRef, item);
                continue;
            }
            blocks.add(new TimeBlockCandidate(taskId, start, end, reader.text("reasoning").orElse("")));
        }
        return new ArrayList<>(blocks);
    }

    private String buildPrompt(LocalDate date, List<SchedulableTask> tasks, List<CalendarEvent> existingEvents) {
        List<Map<String, Object>> taskItems = new ArrayList<>(tasks.size());
        for (SchedulableTask task : tasks) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", String.valueOf(task.id()));
            item.put("title", task.title());
            item.put("priority", task.priority());
            item.put("estimated_minutes",
                    task.estimatedDuration() == null ? null : task.estimatedDuration().toMinutes());
            taskItems.add(item);
        }

        List<Map<String, Object>> eventItems = new ArrayList<>(existingEvents.size());
        for (CalendarEvent event : existingEvents) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("title", event.title());
            item.put("start", String.valueOf(event.start()));
            item.put("end", String.valueOf(event.end()));
            eventItems.add(item);
        }

        return PROMPT.formatted(date, toJson(taskItems), toJson(eventItems), date);
    }
}
