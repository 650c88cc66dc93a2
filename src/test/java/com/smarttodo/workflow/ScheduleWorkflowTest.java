package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.dto.CalendarEvent;
import com.smarttodo.dto.SchedulableTask;
import com.smarttodo.dto.TimeBlockCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.smarttodo.ai.ChatReplies.reply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleWorkflowTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 3);
    private static final UUID REPORT = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000001");
    private static final UUID EMAILS = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000002");
    private static final UUID FOREIGN = UUID.fromString("bbbbbbbb-0000-0000-0000-000000000009");

    private final List<SchedulableTask> tasks = List.of(
            new SchedulableTask(REPORT, "Write report", 1, Duration.ofMinutes(90)),
            new SchedulableTask(EMAILS, "Answer emails", 3, null));

    private ChatModel chatModel;
    private ScheduleWorkflow workflow;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        ObjectMapper mapper = new ObjectMapper();
        workflow = new ScheduleWorkflow(new ReasoningClientFactory(chatModel, mapper, "test-model"), mapper,
                Clock.fixed(Instant.parse("2025-06-02T09:00:00Z"), ZoneOffset.UTC));
    }

    private List<TimeBlockCandidate> suggest() {
        return workflow.suggest(1L, DAY, tasks, List.of(), Set.of(REPORT, EMAILS)::contains);
    }

    @Test
    void validBlocksAreKeptInOrder() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
                {"schedule": [
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000001", "suggested_start_time": "2025-06-03T09:00:00",
                   "suggested_end_time": "2025-06-03T10:30:00", "reasoning": "Deep work first"},
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000002", "suggested_start_time": "2025-06-03T11:00:00Z",
                   "suggested_end_time": "2025-06-03T11:30:00Z", "reasoning": "Low priority"}
                ]}
                """));

        List<TimeBlockCandidate> blocks = suggest();

        assertThat(blocks).containsExactly(
                new TimeBlockCandidate(REPORT, LocalDateTime.of(2025, 6, 3, 9, 0),
                        LocalDateTime.of(2025, 6, 3, 10, 30), "Deep work first"),
                new TimeBlockCandidate(EMAILS, LocalDateTime.of(2025, 6, 3, 11, 0),
                        LocalDateTime.of(2025, 6, 3, 11, 30), "Low priority"));
    }

    @Test
    void invalidBlocksAreDroppedIndividually() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
                {"schedule": [
                  {"task_id": "bbbbbbbb-0000-0000-0000-000000000009", "suggested_start_time": "2025-06-03T09:00:00",
                   "suggested_end_time": "2025-06-03T10:00:00"},
                  {"task_id": "garbage", "suggested_start_time": "2025-06-03T09:00:00",
                   "suggested_end_time": "2025-06-03T10:00:00"},
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000001", "suggested_start_time": "morning",
                   "suggested_end_time": "2025-06-03T10:00:00"},
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000001", "suggested_start_time": "2025-06-03T12:00:00",
                   "suggested_end_time": "2025-06-03T12:00:00"},
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000001", "suggested_start_time": "2025-06-04T09:00:00",
                   "suggested_end_time": "2025-06-04T10:00:00"},
                  {"task_id": "aaaaaaaa-0000-0000-0000-000000000002", "suggested_start_time": "2025-06-03T14:00:00",
                   "suggested_end_time": "2025-06-03T14:30:00", "reasoning": "ok"}
                ]}
                """));

        assertThat(suggest()).singleElement().satisfies(block -> {
            assertThat(block.taskId()).isEqualTo(EMAILS);
            assertThat(block.start()).isEqualTo(LocalDateTime.of(2025, 6, 3, 14, 0));
        });
        assertThat(suggest()).noneMatch(block -> block.taskId().equals(FOREIGN));
    }

    @Test
    void duplicateBlocksCollapse() {
        String block = "{\"task_id\": \"aaaaaaaa-0000-0000-0000-000000000001\", "
                + "\"suggested_start_time\": \"2025-06-03T09:00:00\", \"suggested_end_time\": \"2025-06-03T10:00:00\", "
                + "\"reasoning\": \"r\"}";
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{\"schedule\": [" + block + "," + block + "]}"));

        assertThat(suggest()).hasSize(1);
    }

    @Test
    void failedCallMeansEmptySchedule() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("429 Too Many Requests"));

        assertThat(suggest()).isEmpty();
    }

    @Test
    void promptCarriesTasksAndEvents() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{\"schedule\": []}"));
        CalendarEvent standup = new CalendarEvent("Standup", LocalDateTime.of(2025, 6, 3, 10, 0),
                LocalDateTime.of(2025, 6, 3, 10, 15));

        workflow.suggest(1L, DAY, tasks, List.of(standup), id -> true);

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getInstructions().get(1).getText())
                .contains("Plan 2025-06-03.")
                .contains(REPORT.toString())
                .contains("\"estimated_minutes\" : 90")
                .contains("\"estimated_minutes\" : null")
                .contains("Standup")
                .contains("2025-06-03T10:00");
    }
}
