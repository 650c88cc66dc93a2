package com.smarttodo.repository;

import com.smarttodo.entity.TaskRecommendation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TaskRecommendationRepository extends JpaRepository<TaskRecommendation, UUID> {

    Optional<TaskRecommendation> findByIdAndUserId(UUID id, Long userId);

    List<TaskRecommendation> findByUserId(Long userId);

    List<TaskRecommendation> findByUserIdAndAcceptedFalseAndDismissedFalse(Long userId);

    List<TaskRecommendation> findByUserIdAndDismissedFalseOrderByConfidenceScoreDescCreatedAtDesc(Long userId);

    // Derived deletes load each row first so the context join rows go with them
    long deleteByUserIdAndAcceptedFalseAndDismissedFalse(Long userId);
}
