package com.smarttodo.service;

import com.smarttodo.dto.ContextAnalysis;
import com.smarttodo.dto.RecommendationCandidate;
import com.smarttodo.dto.TaskEnrichment;
import com.smarttodo.dto.TimeBlockCandidate;
import com.smarttodo.entity.ContextEntry;
import com.smarttodo.entity.Task;
import com.smarttodo.entity.TaskRecommendation;
import com.smarttodo.entity.TimeBlockSuggestion;
import com.smarttodo.repository.ContextEntryRepository;
import com.smarttodo.repository.TaskRecommendationRepository;
import com.smarttodo.repository.TaskRepository;
import com.smarttodo.repository.TimeBlockSuggestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes complete workflow results back to storage, one transaction per merge.
 * <p>
 * Every merge overwrites or replaces, never appends, so applying the same result twice
 * leaves the same stored state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentMerger {

    private final TaskRepository taskRepository;
    private final ContextEntryRepository contextEntryRepository;
    private final TaskRecommendationRepository recommendationRepository;
    private final TimeBlockSuggestionRepository timeBlockRepository;
    private final TaskCategoryService categoryService;

    /**
     * @return the updated task, or empty if it was deleted while the job ran
     */
    @Transactional
    public Optional<Task> applyTaskEnrichment(UUID taskId, TaskEnrichment enrichment) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            log.warn("Task {} disappeared before its enrichment could be stored", taskId);
            return Optional.empty();
        }
        Task task = found.get();

        if (enrichment.title().length() <= Task.TITLE_MAX_LENGTH) {
            task.setTitle(enrichment.title());
        } else {
            log.warn("Keeping the title of task {}; the enriched one has {} characters", taskId,
                    enrichment.title().length());
        }
        task.setAiEnhancedDescription(enrichment.enhancedDescription());
        task.setAiReasoning(enrichment.reasoning());
        task.setContextTags(new ArrayList<>(enrichment.contextTags()));
        task.setAiSuggestedPriority(enrichment.priority());
        task.setPriority(enrichment.priority());
        task.setAiSuggestedDeadline(enrichment.deadline());
        if (enrichment.deadline() != null) {
            task.setDeadline(enrichment.deadline());
        }
        // attach only; categories the user picked stay
        task.getCategories().addAll(categoryService.getOrCreateAll(enrichment.suggestedCategories()));

        return Optional.of(taskRepository.save(task));
    }

    @Transactional
    public Optional<ContextEntry> applyContextAnalysis(UUID entryId, ContextAnalysis analysis) {
        Optional<ContextEntry> found = contextEntryRepository.findById(entryId);
        if (found.isEmpty()) {
            log.warn("Context entry {} disappeared before its analysis could be stored", entryId);
            return Optional.empty();
        }
        ContextEntry entry = found.get();

        entry.setSummary(analysis.summary());
        entry.setImportanceScore(analysis.importanceScore());
        entry.setSentiment(analysis.sentiment());
        entry.setKeywords(new ArrayList<>(analysis.keywords()));
        entry.setExtractedTasks(new ArrayList<>(analysis.potentialTasks()));
        entry.setExtractedDeadlines(new ArrayList<>(analysis.mentionedDeadlines()));
        entry.setExtractedPeople(new ArrayList<>(analysis.mentionedPeople()));

        return Optional.of(contextEntryRepository.save(entry));
    }

    /**
     * Drops the user's recommendations that were neither accepted nor dismissed and stores
     * {@code candidates} in their place. Accepted and dismissed ones are history and stay.
     */
    @Transactional
    public List<TaskRecommendation> replaceRecommendations(Long userId, List<RecommendationCandidate> candidates) {
        long superseded = recommendationRepository.deleteByUserIdAndAcceptedFalseAndDismissedFalse(userId);

        List<TaskRecommendation> fresh = new ArrayList<>(candidates.size());
        for (RecommendationCandidate candidate : candidates) {
            TaskRecommendation recommendation = new TaskRecommendation();
            recommendation.setUserId(userId);
            recommendation.setTitle(candidate.title());
            recommendation.setDescription(candidate.description());
            recommendation.setSuggestedPriority(candidate.priority());
            recommendation.setSuggestedDeadline(candidate.deadline());
            recommendation.setReasoning(candidate.reasoning());
            recommendation.setConfidenceScore(candidate.confidenceScore());
            recommendation.setSuggestedCategories(new ArrayList<>(candidate.suggestedCategories()));
            recommendation.setBasedOnContext(new HashSet<>(contextEntryRepository.findAllById(candidate.contextEntryIds())));
            fresh.add(recommendation);
        }
        List<TaskRecommendation> saved = recommendationRepository.saveAll(fresh);

        log.info("Replaced {} unacted recommendations with {} new ones for user {}", superseded, saved.size(), userId);
        return saved;
    }

    /**
     * Replaces every suggestion of this user that starts on {@code date}. Suggestions on
     * other dates are untouched.
     */
    @Transactional
    public List<TimeBlockSuggestion> replaceSchedule(Long userId, LocalDate date, List<TimeBlockCandidate> blocks) {
        int superseded = timeBlockRepository.deleteStartingBetween(userId,
                date.atStartOfDay(), date.plusDays(1).atStartOfDay());

        List<TimeBlockSuggestion> fresh = new ArrayList<>(blocks.size());
        for (TimeBlockCandidate block : blocks) {
            Optional<Task> task = taskRepository.findByIdAndUserId(block.taskId(), userId);
            if (task.isEmpty()) {
                log.warn("Task {} vanished before its time block could be stored for user {}", block.taskId(), userId);
                continue;
            }
            TimeBlockSuggestion suggestion = new TimeBlockSuggestion();
            suggestion.setUserId(userId);
            suggestion.setTask(task.get());
            suggestion.setSuggestedStartTime(block.start());
            suggestion.setSuggestedEndTime(block.end());
            suggestion.setReasoning(block.reasoning());
            fresh.add(suggestion);
        }
        timeBlockRepository.saveAll(fresh);

        log.info("Replaced {} time blocks on {} with {} new ones for user {}", superseded, date, fresh.size(), userId);
        return timeBlockRepository.findStartingBetween(userId, date.atStartOfDay(), date.plusDays(1).atStartOfDay());
    }
}
