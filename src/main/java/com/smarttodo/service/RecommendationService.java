package com.smarttodo.service;

import com.smarttodo.entity.Task;
import com.smarttodo.entity.TaskRecommendation;

import java.util.List;
import java.util.UUID;

public interface RecommendationService {

    void requestRecommendations(Long userId);

    /**
     * Non-dismissed recommendations, most confident first.
     */
    List<TaskRecommendation> listRecommendations(Long userId);

    /**
     * Creates a task from the recommendation. Accepting twice returns the task created the
     * first time.
     *
     * @throws com.smarttodo.exception.RecommendationStateException if it was dismissed
     */
    Task accept(Long userId, UUID recommendationId);

    TaskRecommendation dismiss(Long userId, UUID recommendationId);
}
