package com.portLogistics.aiAssistant.llm.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import com.portLogistics.aiAssistant.classification.pattern.PatternClassifier;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import com.portLogistics.aiAssistant.llm.dto.LlmClassificationPayload;
import com.portLogistics.aiAssistant.llm.model.LlmClassificationOutcome;
import com.portLogistics.aiAssistant.llm.prompt.IntentClassificationPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * LLM-backed intent classifier.
 *
 * Issues exactly one completion call per request, on a dedicated executor, and waits for it with a
 * hard timeout. A call that overruns is cancelled (its worker interrupted) and reported as
 * {@link LlmClassificationOutcome.Status#TIMED_OUT}; provider and transport errors are reported as
 * {@link LlmClassificationOutcome.Status#FAILED}. Neither ever escapes as an exception.
 *
 * A successful answer goes through:
 * - code fence stripping and JSON parsing, with a keyword fallback at a fixed low confidence
 *   when the answer is not valid JSON
 * - validation against the closed intent vocabulary (anything else becomes unknown)
 * - the confidence threshold (below it the intent becomes unknown, confidence kept as reported)
 */
@Slf4j
@Service
public class LlmIntentClassifier {

    static final double KEYWORD_FALLBACK_CONFIDENCE = 0.3;

    private static final Pattern WIRE_NAME = Pattern.compile("(?<![a-z_])(" + Arrays.stream(Intent.values())
            .map(Intent::getWireName)
            .collect(Collectors.joining("|")) + ")(?![a-z_])", Pattern.CASE_INSENSITIVE);

    private final LlmCompletionClient completionClient;
    private final AsyncTaskExecutor executor;
    private final PatternClassifier patternClassifier;
    private final ObjectMapper objectMapper;
    private final ClassificationSettings settings;

    public LlmIntentClassifier(LlmCompletionClient completionClient,
                               @Qualifier("llmClassifierExecutor") AsyncTaskExecutor executor,
                               PatternClassifier patternClassifier,
                               ObjectMapper objectMapper,
                               ClassificationSettings settings) {
        this.completionClient = completionClient;
        this.executor = executor;
        this.patternClassifier = patternClassifier;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /**
     * Classifies a message with the LLM.
     *
     * @param text    Current message
     * @param history Normalized history, most recent last
     * @param traceId Request trace id
     * @return Outcome carrying either a validated result or the failure kind
     */
    public LlmClassificationOutcome classify(String text, List<ConversationTurn> history, String traceId) {
        String prompt = IntentClassificationPrompt.build(text, history);
        long timeoutMs = settings.llmTimeout().toMillis();

        Future<String> call;
        try {
            call = executor.submit(() -> completionClient.complete(prompt, traceId));
        } catch (TaskRejectedException e) {
            log.warn("LLM classification rejected by executor - traceId: {}", traceId);
            return LlmClassificationOutcome.failed("classifier executor saturated");
        }

        String raw;
        try {
            raw = call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("LLM classification timed out - traceId: {}, timeoutMs: {}", traceId, timeoutMs);
            return LlmClassificationOutcome.timedOut("classification timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            // the request thread was cancelled (e.g. client disconnect): abandon the provider call too
            call.cancel(true);
            Thread.currentThread().interrupt();
            log.info("LLM classification cancelled - traceId: {}", traceId);
            return LlmClassificationOutcome.failed("classification cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("LLM classification failed - traceId: {}, error: {}", traceId, cause.getMessage());
            return LlmClassificationOutcome.failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }

        return interpret(raw, traceId);
    }

    /**
     * Turns raw completion text into a validated, thresholded result.
     */
    LlmClassificationOutcome interpret(String raw, String traceId) {
        LlmClassificationPayload payload = parse(raw);
        if (payload == null) {
            Intent fallbackIntent = extractKeywordIntent(raw);
            log.warn("LLM returned malformed output - traceId: {}, keyword fallback: {}", traceId, fallbackIntent);
            IntentResult fallback = IntentResult.builder()
                    .intent(fallbackIntent)
                    .confidence(KEYWORD_FALLBACK_CONFIDENCE)
                    .reason("llm_malformed_output")
                    .reason("keyword_fallback")
                    .build();
            return LlmClassificationOutcome.success(applyThreshold(fallback), true);
        }

        IntentResult.IntentResultBuilder builder = IntentResult.builder().reason("llm_classifier");

        Intent intent = Intent.fromWireName(payload.getIntent()).orElse(null);
        if (intent == null) {
            log.info("LLM intent outside vocabulary - traceId: {}, value: {}", traceId, payload.getIntent());
            builder.reason("llm_out_of_vocabulary");
            intent = Intent.UNKNOWN;
        }

        double confidence = clamp(payload.getConfidence());
        IntentResult result = builder
                .intent(intent)
                .confidence(confidence)
                .entities(scalarEntities(payload.getEntities()))
                .build();

        IntentResult thresholded = applyThreshold(result);
        log.info("LLM classified - traceId: {}, intent: {}, confidence: {}", traceId, thresholded.getIntent(), confidence);
        return LlmClassificationOutcome.success(thresholded, false);
    }

    private IntentResult applyThreshold(IntentResult result) {
        if (result.getIntent() != Intent.UNKNOWN && result.getConfidence() < settings.confidenceThreshold()) {
            return result.toBuilder()
                    .intent(Intent.UNKNOWN)
                    .reason("llm_below_threshold")
                    .build();
        }
        return result;
    }

    private LlmClassificationPayload parse(String raw) {
        String json = stripCodeFences(raw);
        if (json == null) {
            return null;
        }
        try {
            LlmClassificationPayload payload = objectMapper.readValue(json, LlmClassificationPayload.class);
            return payload != null && payload.getIntent() != null ? payload : null;
        } catch (Exception e) {
            log.debug("Unparseable LLM output: {}", e.getMessage());
            return null;
        }
    }

    static String stripCodeFences(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String content = raw.trim();
        if (content.startsWith("```")) {
            int firstNewline = content.indexOf('\n');
            content = firstNewline >= 0 ? content.substring(firstNewline + 1) : content.substring(3);
            int closingFence = content.lastIndexOf("```");
            if (closingFence >= 0) {
                content = content.substring(0, closingFence);
            }
            content = content.trim();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            content = content.substring(start, end + 1);
        }
        return content;
    }

    /**
     * Looks for intent names written as whole tokens first, then for the pattern classifier's keyword families.
     * The first named intent that is not help, smalltalk or unknown wins over those low-information names.
     */
    private Intent extractKeywordIntent(String raw) {
        if (raw == null || raw.isBlank()) {
            return Intent.UNKNOWN;
        }
        Intent lowInformation = null;
        Matcher matcher = WIRE_NAME.matcher(raw);
        while (matcher.find()) {
            Intent named = Intent.fromWireName(matcher.group(1)).orElse(Intent.UNKNOWN);
            if (!named.isLowInformation()) {
                return named;
            }
            if (lowInformation == null && named != Intent.UNKNOWN) {
                lowInformation = named;
            }
        }
        return lowInformation != null ? lowInformation : patternClassifier.matchKeywords(raw);
    }

    private static double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static Map<String, Object> scalarEntities(Map<String, Object> entities) {
        Map<String, Object> kept = new LinkedHashMap<>();
        if (entities == null) {
            return kept;
        }
        entities.forEach((key, value) -> {
            if (key != null && (value instanceof String || value instanceof Number || value instanceof Boolean)) {
                kept.put(key, value instanceof String ? ((String) value).trim() : value);
            }
        });
        return kept;
    }
}
