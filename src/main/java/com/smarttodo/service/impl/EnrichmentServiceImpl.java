package com.smarttodo.service.impl;

import com.smarttodo.dto.CalendarEvent;
import com.smarttodo.dto.ContextAnalysis;
import com.smarttodo.dto.ContextSnippet;
import com.smarttodo.dto.RecommendationCandidate;
import com.smarttodo.dto.SchedulableTask;
import com.smarttodo.dto.TaskEnrichment;
import com.smarttodo.dto.TaskInput;
import com.smarttodo.dto.TimeBlockCandidate;
import com.smarttodo.dto.WorkloadSummary;
import com.smarttodo.entity.ContextEntry;
import com.smarttodo.entity.Task;
import com.smarttodo.entity.TimeBlockSuggestion;
import com.smarttodo.entity.UserProfile;
import com.smarttodo.enums.Priorities;
import com.smarttodo.enums.TaskStatus;
import com.smarttodo.repository.ContextEntryRepository;
import com.smarttodo.repository.TaskRepository;
import com.smarttodo.repository.UserProfileRepository;
import com.smarttodo.service.EnrichmentMerger;
import com.smarttodo.service.EnrichmentService;
import com.smarttodo.workflow.ContextAnalysisWorkflow;
import com.smarttodo.workflow.RecommendationWorkflow;
import com.smarttodo.workflow.ScheduleWorkflow;
import com.smarttodo.workflow.TaskEnrichmentWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentServiceImpl implements EnrichmentService {

    static final String WORK_HOURS = "work_hours";

    private final TaskRepository taskRepository;
    private final ContextEntryRepository contextEntryRepository;
    private final UserProfileRepository userProfileRepository;
    private final TaskEnrichmentWorkflow taskEnrichmentWorkflow;
    private final ContextAnalysisWorkflow contextAnalysisWorkflow;
    private final RecommendationWorkflow recommendationWorkflow;
    private final ScheduleWorkflow scheduleWorkflow;
    private final EnrichmentMerger merger;
    private final Clock clock;

    @Value("${smarttodo.enrichment.context-window:10}")
    private int enrichmentContextWindow = 10;

    @Value("${smarttodo.recommendation.context-window:20}")
    private int recommendationContextWindow = 20;

    @Value("${smarttodo.ai.default-work-hours:9am-6pm}")
    private String defaultWorkHours = "9am-6pm";

    @Override
    public void enrichTask(UUID taskId) {
        try {
            Optional<Task> found = taskRepository.findById(taskId);
            if (found.isEmpty()) {
                log.warn("Task {} not found for AI processing", taskId);
                return;
            }
            Task task = found.get();
            Long userId = task.getUserId();

            List<ContextSnippet> context = snippets(contextEntryRepository.findByUserIdOrderByEntryDateDescCreatedAtDesc(
                    userId, PageRequest.of(0, enrichmentContextWindow)));

            TaskEnrichment enrichment = taskEnrichmentWorkflow.enrich(userId, taskId,
                    new TaskInput(task.getTitle(), task.getDescription(), task.getPriority()),
                    context, workload(userId), preferences(userId));

            if (merger.applyTaskEnrichment(taskId, enrichment).isPresent()) {
                log.info("Processed task {} with AI pipeline", taskId);
            }
        } catch (Exception e) {
            log.error("Error in AI task processing for task {}", taskId, e);
        }
    }

    @Override
    public void analyzeContextEntry(UUID entryId) {
        try {
            Optional<ContextEntry> found = contextEntryRepository.findById(entryId);
            if (found.isEmpty()) {
                log.warn("Context entry {} not found for AI processing", entryId);
                return;
            }
            ContextEntry entry = found.get();

            ContextAnalysis analysis = contextAnalysisWorkflow.analyze(entry.getUserId(), entryId,
                    entry.getContent(), entry.getEntryType().getLabel());

            if (merger.applyContextAnalysis(entryId, analysis).isPresent()) {
                log.info("Analyzed context entry {} with AI", entryId);
            }
        } catch (Exception e) {
            log.error("Error in AI context processing for entry {}", entryId, e);
        }
    }

    @Override
    public void generateRecommendations(Long userId) {
        try {
            List<ContextSnippet> context = snippets(contextEntryRepository.findByUserIdOrderByCreatedAtDesc(
                    userId, PageRequest.of(0, recommendationContextWindow)));
            List<String> activeTitles = taskRepository
                    .findByUserIdAndStatusInOrderByPriorityAscCreatedAtAsc(userId, TaskStatus.ACTIVE)
                    .stream()
                    .map(Task::getTitle)
                    .collect(Collectors.toList());

            List<RecommendationCandidate> candidates = recommendationWorkflow.recommend(userId, context, activeTitles);

            // runs even when the call failed, so stale unacted suggestions are still cleared
            merger.replaceRecommendations(userId, candidates);
        } catch (Exception e) {
            log.error("Error generating recommendations for user {}", userId, e);
        }
    }

    @Override
    public List<TimeBlockSuggestion> generateSchedule(Long userId, LocalDate date, List<CalendarEvent> existingEvents) {
        try {
            List<SchedulableTask> tasks = taskRepository
                    .findByUserIdAndStatusInOrderByPriorityAscCreatedAtAsc(userId, TaskStatus.ACTIVE)
                    .stream()
                    .map(t -> new SchedulableTask(t.getId(), t.getTitle(), t.getPriority(), t.getEstimatedDuration()))
                    .collect(Collectors.toList());

            List<TimeBlockCandidate> blocks = scheduleWorkflow.suggest(userId, date, tasks, existingEvents,
                    taskId -> taskRepository.findByIdAndUserId(taskId, userId).isPresent());

            return merger.replaceSchedule(userId, date, blocks);
        } catch (Exception e) {
            log.error("Error generating schedule for user {} on {}", userId, date, e);
            return List.of();
        }
    }

    WorkloadSummary workload(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return new WorkloadSummary(
                taskRepository.countByUserIdAndStatusIn(userId, TaskStatus.ACTIVE),
                taskRepository.countByUserIdAndStatusInAndPriority(userId, TaskStatus.ACTIVE, Priorities.HIGH),
                taskRepository.countByUserIdAndStatusInAndDeadlineBetween(userId, TaskStatus.ACTIVE,
                        now, now.plusDays(7)));
    }

    Map<String, String> preferences(Long userId) {
        Map<String, String> preferences = new LinkedHashMap<>();
        preferences.put(WORK_HOURS, defaultWorkHours);
        userProfileRepository.findById(userId)
                .map(UserProfile::getPreferences)
                .ifPresent(preferences::putAll);
        return preferences;
    }

    private static List<ContextSnippet> snippets(List<ContextEntry> entries) {
        return entries.stream()
                .map(e -> new ContextSnippet(e.getId(), e.getEntryType().getLabel(), e.getEntryDate(), e.getContent()))
                .collect(Collectors.toList());
    }
}
