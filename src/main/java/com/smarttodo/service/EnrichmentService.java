package com.smarttodo.service;

import com.smarttodo.dto.CalendarEvent;
import com.smarttodo.entity.TimeBlockSuggestion;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Job entry points of the enrichment pipeline. Each one loads its inputs fresh, runs one
 * workflow (one model call) and stores the result. None of them throws: failures are logged
 * and leave stored data as it was.
 */
public interface EnrichmentService {

    void enrichTask(UUID taskId);

    void analyzeContextEntry(UUID entryId);

    void generateRecommendations(Long userId);

    /**
     * Synchronous, on-demand variant for the schedule.
     *
     * @return the suggestions now stored for that date, ordered by start time
     */
    List<TimeBlockSuggestion> generateSchedule(Long userId, LocalDate date, List<CalendarEvent> existingEvents);
}
