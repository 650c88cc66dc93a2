package com.smarttodo.service.impl;

import com.smarttodo.entity.Task;
import com.smarttodo.entity.TaskRecommendation;
import com.smarttodo.event.RecommendationsRequestedEvent;
import com.smarttodo.exception.RecommendationStateException;
import com.smarttodo.exception.ResourceNotFoundException;
import com.smarttodo.repository.TaskRecommendationRepository;
import com.smarttodo.repository.TaskRepository;
import com.smarttodo.service.RecommendationService;
import com.smarttodo.service.TaskCategoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationServiceImpl implements RecommendationService {

    private final TaskRecommendationRepository recommendationRepository;
    private final TaskRepository taskRepository;
    private final TaskCategoryService categoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public void requestRecommendations(Long userId) {
        log.info("Recommendation generation requested for user {}", userId);
        eventPublisher.publishEvent(new RecommendationsRequestedEvent(this, userId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskRecommendation> listRecommendations(Long userId) {
        return recommendationRepository.findByUserIdAndDismissedFalseOrderByConfidenceScoreDescCreatedAtDesc(userId);
    }

    @Override
    @Transactional
    public Task accept(Long userId, UUID recommendationId) {
        TaskRecommendation recommendation = find(userId, recommendationId);
        if (recommendation.isAccepted() && recommendation.getCreatedTask() != null) {
            return recommendation.getCreatedTask();
        }
        if (recommendation.isDismissed()) {
            throw new RecommendationStateException("Recommendation " + recommendationId + " was dismissed");
        }

        Task task = new Task();
        task.setUserId(userId);
        task.setCreatedAt(LocalDateTime.now(clock));
        task.setTitle(recommendation.getTitle());
        task.setDescription(recommendation.getDescription());
        task.setPriority(recommendation.getSuggestedPriority());
        task.setDeadline(recommendation.getSuggestedDeadline());
        task.setAiReasoning(recommendation.getReasoning());
        task.getCategories().addAll(categoryService.getOrCreateAll(recommendation.getSuggestedCategories()));
        Task saved = taskRepository.save(task);

        recommendation.setAccepted(true);
        recommendation.setCreatedTask(saved);
        recommendationRepository.save(recommendation);

        log.info("Accepted recommendation {} as task {} for user {}", recommendationId, saved.getId(), userId);
        return saved;
    }

    @Override
    @Transactional
    public TaskRecommendation dismiss(Long userId, UUID recommendationId) {
        TaskRecommendation recommendation = find(userId, recommendationId);
        if (recommendation.isAccepted()) {
            throw new RecommendationStateException("Recommendation " + recommendationId + " was already accepted");
        }
        if (!recommendation.isDismissed()) {
            recommendation.setDismissed(true);
            recommendation = recommendationRepository.save(recommendation);
            log.info("Dismissed recommendation {} for user {}", recommendationId, userId);
        }
        return recommendation;
    }

    private TaskRecommendation find(Long userId, UUID recommendationId) {
        return recommendationRepository.findByIdAndUserId(recommendationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Recommendation", recommendationId));
    }
}
