package com.portLogistics.aiAssistant.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Builds the process-wide configuration value and the executor used for LLM classification calls.
 */
@Slf4j
@Configuration
public class AssistantConfiguration {

    @Bean
    public ClassificationSettings classificationSettings(
            @Value("${assistant.llm.enabled:false}") boolean llmEnabled,
            @Value("${assistant.llm.provider:groq}") String llmProvider,
            @Value("${assistant.llm.model:llama-3.1-8b-instant}") String llmModel,
            @Value("${assistant.llm.api-key:}") String llmApiKey,
            @Value("${assistant.llm.timeout:6s}") Duration llmTimeout,
            @Value("${assistant.llm.confidence-threshold:0.45}") double confidenceThreshold,
            @Value("${assistant.llm.temperature:0.1}") double llmTemperature,
            @Value("${assistant.llm.max-tokens:100}") int llmMaxTokens,
            @Value("${assistant.history.limit:10}") int historyLimit,
            @Value("${assistant.history.follow-up-window:6}") int followUpWindow,
            @Value("${assistant.timezone:Africa/Algiers}") String timezone) {

        ClassificationSettings settings = ClassificationSettings.builder()
                .llmEnabled(llmEnabled)
                .llmProvider(llmProvider)
                .llmModel(llmModel)
                .llmApiKey(llmApiKey)
                .llmTimeout(llmTimeout)
                .confidenceThreshold(confidenceThreshold)
                .llmTemperature(llmTemperature)
                .llmMaxTokens(llmMaxTokens)
                .historyLimit(historyLimit)
                .followUpWindow(followUpWindow)
                .timezone(ZoneId.of(timezone))
                .build();

        if (llmEnabled && !settings.hasApiKey()) {
            log.error("LLM classification enabled with provider {} but no API key set - pattern classifier will be used", llmProvider);
        } else if (settings.isLlmConfigured()) {
            log.info("LLM classification enabled - provider: {}, model: {}, timeout: {}", llmProvider, llmModel, llmTimeout);
        } else {
            log.info("LLM classification disabled - using pattern classifier");
        }
        return settings;
    }

    /**
     * Bounded pool for LLM calls. The classifier waits on the returned future with a hard timeout
     * and interrupts the worker when the timeout expires.
     */
    @Bean("llmClassifierExecutor")
    public ThreadPoolTaskExecutor llmClassifierExecutor(
            @Value("${assistant.llm.executor.core-pool-size:4}") int corePoolSize,
            @Value("${assistant.llm.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${assistant.llm.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        // a saturated pool rejects; the classifier reports that as a failure and the pattern path takes over
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("LlmClassifier-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
