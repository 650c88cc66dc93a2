package com.smarttodo.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smarttodo.ai.PayloadReader;
import com.smarttodo.ai.ReasoningClientFactory;
import com.smarttodo.ai.ReasoningRequest;
import com.smarttodo.dto.ContextAnalysis;
import com.smarttodo.enums.Sentiment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Extracts summary, sentiment, importance and implied tasks/deadlines/people from one
 * context entry. A failed call yields {@link #FALLBACK}, so callers never branch on errors.
 */
@Component
public class ContextAnalysisWorkflow extends ReasoningWorkflow {

    public static final String FALLBACK_SUMMARY = "Could not analyze content.";
    public static final double DEFAULT_IMPORTANCE = 0.5;

    public static final ContextAnalysis FALLBACK = new ContextAnalysis(FALLBACK_SUMMARY, DEFAULT_IMPORTANCE,
            Sentiment.NEUTRAL, List.of(), List.of(), List.of(), List.of());

    static final double TEMPERATURE = 0.2;
    static final int MAX_TOKENS = 600;

    private static final String INSTRUCTION = """
            You are an information extraction engine. You read snippets from a person's day
            (messages, emails, notes, meetings, calls, documents) and pull out structured, actionable data.
            """;

    private static final String PROMPT = """
            Analyze this context entry.

            Entry type: %s
            Content:
            ---
            %s
            ---

            Return a JSON object with these fields:
            1. "summary": one sentence summarising the content.
            2. "importance_score": number between 0.0 and 1.0, how important or actionable this is.
            3. "sentiment": one of "positive", "negative", "neutral".
            4. "keywords": array of the 3-5 most important keywords or phrases.
            5. "potential_tasks": array of to-do items implied by the content.
            6. "mentioned_deadlines": array of dates or deadlines mentioned, copied as written.
            7. "mentioned_people": array of names of people mentioned.
            """;

    public ContextAnalysisWorkflow(ReasoningClientFactory clientFactory, ObjectMapper objectMapper, Clock clock) {
        super(clientFactory, objectMapper, clock);
    }

    public ContextAnalysis analyze(Long userId, UUID entryId, String content, String entryTypeLabel) {
        ReasoningRequest request = new ReasoningRequest(INSTRUCTION,
                PROMPT.formatted(entryTypeLabel, nullToEmpty(content)), TEMPERATURE, MAX_TOKENS);

        return clientFor(userId, "context:" + entryId)
                .request(request)
                .fold(this::fromPayload, failure -> FALLBACK);
    }

    ContextAnalysis fromPayload(ObjectNode payload) {
        PayloadReader reader = PayloadReader.of(payload);
        return new ContextAnalysis(
                reader.nonBlankText("summary").orElse(FALLBACK_SUMMARY),
                reader.score("importance_score").orElse(DEFAULT_IMPORTANCE),
                Sentiment.parse(reader.text("sentiment").orElse(null)),
                reader.strings("keywords"),
                reader.strings("potential_tasks"),
                reader.strings("mentioned_deadlines"),
                reader.strings("mentioned_people"));
    }
}
