package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.dto.ContextSnippet;
import com.smarttodo.dto.TaskEnrichment;
import com.smarttodo.dto.TaskInput;
import com.smarttodo.dto.WorkloadSummary;
import com.smarttodo.entity.Task;
import com.smarttodo.entity.TaskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.smarttodo.ai.ChatReplies.reply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskEnrichmentWorkflowTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-02T09:00:00Z"), ZoneOffset.UTC);
    private static final UUID TASK_ID = UUID.fromString("6f1c2a4e-0d6b-4d8e-9c1a-2b3c4d5e6f70");
    private static final WorkloadSummary WORKLOAD = new WorkloadSummary(5, 2, 1);

    private ChatModel chatModel;
    private TaskEnrichmentWorkflow workflow;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        ObjectMapper mapper = new ObjectMapper();
        workflow = new TaskEnrichmentWorkflow(new ReasoningClientFactory(chatModel, mapper, "test-model"), mapper, CLOCK);
    }

    private TaskEnrichment enrich(TaskInput input) {
        return workflow.enrich(1L, TASK_ID, input, List.of(), WORKLOAD, Map.of("work_hours", "9am-6pm"));
    }

    @Test
    void failedCallKeepsUserValues() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new ResourceAccessException("timeout"));

        TaskEnrichment result = enrich(new TaskInput("fix bug", "", 3));

        assertThat(result.title()).isEqualTo("fix bug");
        assertThat(result.enhancedDescription()).isEmpty();
        assertThat(result.priority()).isEqualTo(3);
        assertThat(result.deadline()).isNull();
        assertThat(result.suggestedCategories()).isEmpty();
        assertThat(result.contextTags()).isEmpty();
        assertThat(result.reasoning()).isEqualTo(TaskEnrichmentWorkflow.FALLBACK_REASONING);
    }

    @Test
    void validResponseIsMapped() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
                {
                  "title": "Prepare Q3 budget review deck",
                  "enhanced_description": "Slides for Friday's review with Alice",
                  "priority": 1,
                  "deadline": "2025-06-06T17:00:00Z",
                  "suggested_categories": ["Work", "Finance"],
                  "context_tags": ["budget", "Q3"],
                  "reasoning": "Due Friday and the manager asked for it."
                }
                """));

        TaskEnrichment result = enrich(new TaskInput("budget slides", null, 3));

        assertThat(result.title()).isEqualTo("Prepare Q3 budget review deck");
        assertThat(result.enhancedDescription()).isEqualTo("Slides for Friday's review with Alice");
        assertThat(result.priority()).isEqualTo(1);
        assertThat(result.deadline()).isEqualTo(LocalDateTime.of(2025, 6, 6, 17, 0));
        assertThat(result.suggestedCategories()).containsExactly("Work", "Finance");
        assertThat(result.contextTags()).containsExactly("budget", "Q3");
        assertThat(result.reasoning()).startsWith("Due Friday");
    }

    @Test
    void unparseableDeadlineIsDroppedButRestIsKept() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply(
                "{\"title\": \"Call landlord\", \"priority\": 2, \"deadline\": \"next Friday\", \"context_tags\": [\"home\"]}"));

        TaskEnrichment result = enrich(new TaskInput("landlord", "about the lease", 3));

        assertThat(result.deadline()).isNull();
        assertThat(result.title()).isEqualTo("Call landlord");
        assertThat(result.priority()).isEqualTo(2);
        assertThat(result.contextTags()).containsExactly("home");
        assertThat(result.enhancedDescription()).isEqualTo("about the lease");
    }

    @Test
    void outOfRangePriorityFallsBackToUserPriority() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{\"title\": \"x\", \"priority\": 7}"));

        assertThat(enrich(new TaskInput("x", "", 2)).priority()).isEqualTo(2);
    }

    @Test
    void overlongValuesAreDroppedWithoutLosingTheRest() {
        String longTitle = "T".repeat(Task.TITLE_MAX_LENGTH + 1);
        String longCategory = "x".repeat(120);
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
                {"title": "%s", "priority": 1, "suggested_categories": ["Work", "%s"],
                 "reasoning": "Manager is waiting on it."}
                """.formatted(longTitle, longCategory)));

        TaskEnrichment result = enrich(new TaskInput("fix bug", "", 3));

        assertThat(result.title()).isEqualTo("fix bug");
        assertThat(result.priority()).isEqualTo(1);
        assertThat(result.suggestedCategories()).containsExactly("Work");
        assertThat(result.reasoning()).isEqualTo("Manager is waiting on it.");
    }

    @Test
    void valuesAtTheColumnLimitAreKept() {
        String title = "T".repeat(Task.TITLE_MAX_LENGTH);
        String category = "c".repeat(TaskCategory.NAME_MAX_LENGTH);
        when(chatModel.call(any(Prompt.class))).thenReturn(reply(
                "{\"title\": \"%s\", \"suggested_categories\": [\"%s\"]}".formatted(title, category)));

        TaskEnrichment result = enrich(new TaskInput("fix bug", "", 3));

        assertThat(result.title()).isEqualTo(title);
        assertThat(result.suggestedCategories()).containsExactly(category);
    }

    @Test
    void promptCarriesTaskContextAndWorkload() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{}"));
        ContextSnippet email = new ContextSnippet(UUID.randomUUID(), "Email", LocalDate.of(2025, 6, 1),
                "Alice: budget review moved to Friday");

        workflow.enrich(1L, TASK_ID, new TaskInput("budget slides", "", 3), List.of(email), WORKLOAD,
                Map.of("work_hours", "9am-6pm"));

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        String userPrompt = captor.getValue().getInstructions().get(1).getText();
        assertThat(userPrompt)
                .contains("\"budget slides\"")
                .contains("3 (Low)")
                .contains("Alice: budget review moved to Friday")
                .contains("\"high_priority\" : 2")
                .contains("\"work_hours\" : \"9am-6pm\"");
        assertThat(captor.getValue().getOptions().getTemperature()).isEqualTo(TaskEnrichmentWorkflow.TEMPERATURE);
    }
}
