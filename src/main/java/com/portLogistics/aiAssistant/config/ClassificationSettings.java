package com.portLogistics.aiAssistant.config;

import lombok.Builder;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable classifier and orchestration settings, read once at startup.
 *
 * @param llmEnabled          LLM classification toggle
 * @param llmProvider         Provider name reported by the config endpoint (e.g. "groq")
 * @param llmModel            Model used for classification
 * @param llmApiKey           Provider API key; the LLM path is skipped when blank
 * @param llmTimeout          Hard timeout for the single classification call
 * @param confidenceThreshold LLM results below this confidence are downgraded to unknown
 * @param llmTemperature      Sampling temperature for classification
 * @param llmMaxTokens        Completion budget for classification
 * @param historyLimit        Turns kept after history normalization
 * @param followUpWindow      Most recent turns the follow-up resolver looks at
 * @param timezone            Zone used to resolve relative dates
 */
@Builder(toBuilder = true)
public record ClassificationSettings(
        boolean llmEnabled,
        String llmProvider,
        String llmModel,
        String llmApiKey,
        Duration llmTimeout,
        double confidenceThreshold,
        double llmTemperature,
        int llmMaxTokens,
        int historyLimit,
        int followUpWindow,
        ZoneId timezone) {

    /**
     * @return true when the LLM path is both enabled and has credentials
     */
    public boolean isLlmConfigured() {
        return llmEnabled && llmApiKey != null && !llmApiKey.isBlank();
    }

    public boolean hasApiKey() {
        return llmApiKey != null && !llmApiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ClassificationSettings{llmEnabled=" + llmEnabled
                + ", llmProvider=" + llmProvider
                + ", llmModel=" + llmModel
                + ", hasApiKey=" + hasApiKey()
                + ", llmTimeout=" + llmTimeout
                + ", confidenceThreshold=" + confidenceThreshold
                + ", historyLimit=" + historyLimit
                + ", followUpWindow=" + followUpWindow
                + ", timezone=" + timezone + "}";
    }
}
