package com.smarttodo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.service.EnrichmentMerger;
import com.smarttodo.service.TaskCategoryService;
import com.smarttodo.service.impl.ContextEntryServiceImpl;
import com.smarttodo.service.impl.EnrichmentServiceImpl;
import com.smarttodo.service.impl.RecommendationServiceImpl;
import com.smarttodo.service.impl.TaskServiceImpl;
import com.smarttodo.workflow.ContextAnalysisWorkflow;
import com.smarttodo.workflow.RecommendationWorkflow;
import com.smarttodo.workflow.ScheduleWorkflow;
import com.smarttodo.workflow.TaskEnrichmentWorkflow;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the pipeline on top of a JPA slice. The {@link ChatModel} itself is supplied by each
 * test as a Mockito bean.
 */
@TestConfiguration
@Import({EnrichmentMerger.class, TaskCategoryService.class, EnrichmentServiceImpl.class,
        TaskServiceImpl.class, ContextEntryServiceImpl.class, RecommendationServiceImpl.class})
public class PipelineTestConfig {

    public static final Instant NOW = Instant.parse("2025-06-02T09:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Bean
    public Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    public ReasoningClientFactory reasoningClientFactory(ChatModel chatModel) {
        return new ReasoningClientFactory(chatModel, objectMapper, "test-model");
    }

    @Bean
    public TaskEnrichmentWorkflow taskEnrichmentWorkflow(ReasoningClientFactory factory, Clock clock) {
        return new TaskEnrichmentWorkflow(factory, objectMapper, clock);
    }

    @Bean
    public ContextAnalysisWorkflow contextAnalysisWorkflow(ReasoningClientFactory factory, Clock clock) {
        return new ContextAnalysisWorkflow(factory, objectMapper, clock);
    }

    @Bean
    public RecommendationWorkflow recommendationWorkflow(ReasoningClientFactory factory, Clock clock) {
        return new RecommendationWorkflow(factory, objectMapper, clock);
    }

    @Bean
    public ScheduleWorkflow scheduleWorkflow(ReasoningClientFactory factory, Clock clock) {
        return new ScheduleWorkflow(factory, objectMapper, clock);
    }
}
