package com.portLogistics.aiAssistant.llm.model;

import com.portLogistics.aiAssistant.classification.model.IntentResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one LLM classification attempt.
 *
 * Failures are values, not exceptions: the orchestrator checks {@link #getStatus()} and falls back
 * to the pattern classifier on anything but {@link Status#SUCCESS}.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LlmClassificationOutcome {

    public enum Status {
        /** The provider answered; the result may still be unknown after validation and thresholding. */
        SUCCESS,
        /** The call exceeded the configured timeout and was abandoned. */
        TIMED_OUT,
        /** Transport, provider or scheduling error, or the caller was cancelled. */
        FAILED
    }

    private final Status status;

    /**
     * Classification result; only set on success.
     */
    private final IntentResult result;

    /**
     * Short description of the failure; null on success.
     */
    private final String errorMessage;

    /**
     * True when the provider answer could not be parsed and keyword extraction was used instead.
     */
    private final boolean malformed;

    public static LlmClassificationOutcome success(IntentResult result, boolean malformed) {
        return new LlmClassificationOutcome(Status.SUCCESS, result, null, malformed);
    }

    public static LlmClassificationOutcome timedOut(String errorMessage) {
        return new LlmClassificationOutcome(Status.TIMED_OUT, null, errorMessage, false);
    }

    public static LlmClassificationOutcome failed(String errorMessage) {
        return new LlmClassificationOutcome(Status.FAILED, null, errorMessage, false);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
