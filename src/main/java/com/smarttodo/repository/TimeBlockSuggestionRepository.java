package com.smarttodo.repository;

import com.smarttodo.entity.TimeBlockSuggestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface TimeBlockSuggestionRepository extends JpaRepository<TimeBlockSuggestion, UUID> {

    @Query("SELECT s FROM TimeBlockSuggestion s WHERE s.userId = :userId "
            + "AND s.suggestedStartTime >= :from AND s.suggestedStartTime < :to ORDER BY s.suggestedStartTime")
    List<TimeBlockSuggestion> findStartingBetween(@Param("userId") Long userId,
            @Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TimeBlockSuggestion s WHERE s.userId = :userId "
            + "AND s.suggestedStartTime >= :from AND s.suggestedStartTime < :to")
    int deleteStartingBetween(@Param("userId") Long userId,
            @Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    List<TimeBlockSuggestion> findByUserIdOrderBySuggestedStartTime(Long userId);
}
