package com.smarttodo.listener;

import com.smarttodo.config.AsyncConfig;
import com.smarttodo.event.ContextAnalysisRequestedEvent;
import com.smarttodo.event.RecommendationsRequestedEvent;
import com.smarttodo.event.TaskEnrichmentRequestedEvent;
import com.smarttodo.service.EnrichmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs enrichment jobs in the background once the write that requested them has committed.
 * A rolled-back write never starts a job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentJobListener {

    static final String MDC_JOB = "job";
    static final String MDC_ENTITY = "entity";

    private final EnrichmentService enrichmentService;

    @Async(AsyncConfig.ENRICHMENT_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onTaskEnrichmentRequested(TaskEnrichmentRequestedEvent event) {
        runJob("enrich-task", "task:" + event.getTaskId(), () -> enrichmentService.enrichTask(event.getTaskId()));
    }

    @Async(AsyncConfig.ENRICHMENT_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onContextAnalysisRequested(ContextAnalysisRequestedEvent event) {
        runJob("analyze-context", "context:" + event.getEntryId(),
                () -> enrichmentService.analyzeContextEntry(event.getEntryId()));
    }

    @Async(AsyncConfig.ENRICHMENT_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onRecommendationsRequested(RecommendationsRequestedEvent event) {
        runJob("recommend", "user:" + event.getUserId(),
                () -> enrichmentService.generateRecommendations(event.getUserId()));
    }

    private void runJob(String job, String entity, Runnable body) {
        MDC.put(MDC_JOB, job);
        MDC.put(MDC_ENTITY, entity);
        try {
            log.debug("Starting job {} for {}", job, entity);
            body.run();
        } catch (RuntimeException e) {
            log.error("Job {} for {} failed", job, entity, e);
        } finally {
            MDC.remove(MDC_JOB);
            MDC.remove(MDC_ENTITY);
        }
    }
}
