package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.access.service.AccessPolicy;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationalAgentsTest {

    private final HelpAgent helpAgent = new HelpAgent(new AccessPolicy());

    @Test
    @SuppressWarnings("unchecked")
    void helpListsOnlyCapabilitiesOfTheCallerRole() {
        AgentResponse carrier = helpAgent.run(context("help", "CARRIER"));
        AgentResponse operator = helpAgent.run(context("help", "operator"));

        List<String> carrierCapabilities = (List<String>) carrier.getData().get("capabilities");
        List<String> operatorCapabilities = (List<String>) operator.getData().get("capabilities");

        assertThat(carrierCapabilities).anyMatch(c -> c.startsWith("Book a slot"))
                .noneMatch(c -> c.contains("blockchain"));
        assertThat(operatorCapabilities).anyMatch(c -> c.contains("blockchain"))
                .noneMatch(c -> c.startsWith("Book a slot"));
        assertThat(carrier.isError()).isFalse();
    }

    @Test
    void helpForAnonymousCallerSuggestsSigningIn() {
        AgentResponse response = helpAgent.run(context("help", null));

        assertThat((List<?>) response.getData().get("capabilities")).isEmpty();
        assertThat(response.getMessage()).contains("Sign in");
        assertThat(response.getProofs()).containsEntry("trace_id", "trace-7");
    }

    @Test
    void smallTalkRepliesToGreetingsThanksAndFarewells() {
        SmallTalkAgent agent = new SmallTalkAgent();

        assertThat(agent.run(context("Merci beaucoup", "CARRIER")).getMessage()).startsWith("You're welcome");
        assertThat(agent.run(context("ok bye", "CARRIER")).getMessage()).startsWith("Goodbye");
        assertThat(agent.run(context("Salut, ça va ?", "CARRIER")).getMessage()).startsWith("I'm doing well");
    }

    @Test
    void unknownAgentPointsToHelp() {
        AgentResponse response = new UnknownIntentAgent().run(context("blah", null));

        assertThat(response.isError()).isFalse();
        assertThat(response.getMessage()).contains("help");
        assertThat(response.getData()).containsKey("suggestions");
    }

    private static AgentContext context(String message, String role) {
        return AgentContext.builder()
                .message(message)
                .intent(Intent.HELP)
                .entities(ExtractedEntities.empty())
                .history(List.of())
                .role(role)
                .traceId("trace-7")
                .build();
    }
}
