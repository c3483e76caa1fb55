package com.portLogistics.aiAssistant.agent.registry;

import com.portLogistics.aiAssistant.agent.model.Agent;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Intent to agent mapping, built once from every {@link Agent} bean in the context.
 */
@Slf4j
@Component
public class AgentRegistry {

    private final Map<Intent, Agent> agents;

    public AgentRegistry(List<Agent> agents) {
        Map<Intent, Agent> byIntent = new EnumMap<>(Intent.class);
        for (Agent agent : agents) {
            Intent intent = agent.intent();
            if (intent == null) {
                throw new IllegalStateException("Agent " + agent.getClass().getSimpleName() + " declares no intent");
            }
            Agent previous = byIntent.putIfAbsent(intent, agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate agents for intent " + intent + ": "
                        + previous.getClass().getSimpleName() + " and " + agent.getClass().getSimpleName());
            }
        }
        this.agents = Collections.unmodifiableMap(byIntent);
        log.info("Agent registry initialized - intents: {}", this.agents.keySet());
    }

    public Optional<Agent> find(Intent intent) {
        return Optional.ofNullable(intent == null ? null : agents.get(intent));
    }
}
