package com.portLogistics.aiAssistant.agent.registry;

import com.portLogistics.aiAssistant.agent.model.Agent;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentDispatcherTest {

    private static final String TRACE_ID = "trace-42";

    @Test
    void runsRegisteredAgentAndFillsEnvelope() {
        Agent agent = new FixedAgent(Intent.HELP,
                AgentResponse.builder().message("hi").data(Map.of("capabilities", List.of())).build());
        AgentDispatcher dispatcher = new AgentDispatcher(new AgentRegistry(List.of(agent)));

        AgentDispatcher.DispatchResult result = dispatcher.dispatch(Intent.HELP, context(Intent.HELP));

        assertThat(result.handled()).isTrue();
        assertThat(result.agentName()).isEqualTo("FixedAgent");
        assertThat(result.response().getMessage()).isEqualTo("hi");
        assertThat(result.response().getData()).containsEntry("error", false).containsKey("capabilities");
        assertThat(result.response().getProofs()).containsEntry("trace_id", TRACE_ID);
    }

    @Test
    void missingHandlerYieldsNotImplementedEnvelope() {
        AgentDispatcher dispatcher = new AgentDispatcher(new AgentRegistry(List.of()));

        AgentDispatcher.DispatchResult result = dispatcher.dispatch(Intent.CARRIER_SCORE, context(Intent.CARRIER_SCORE));

        assertThat(result.handled()).isFalse();
        assertThat(result.response().isError()).isTrue();
        assertThat(result.response().getErrorType()).isEqualTo("NotImplemented");
        assertThat(result.response().getData()).containsEntry("requested_intent", "carrier_score");
        assertThat(result.response().getProofs()).containsEntry("trace_id", TRACE_ID);
    }

    @Test
    void agentExceptionBecomesErrorEnvelope() {
        Agent failing = new Agent() {
            @Override
            public Intent intent() {
                return Intent.BOOKING_STATUS;
            }

            @Override
            public AgentResponse run(AgentContext context) {
                throw new IllegalStateException("boom");
            }
        };
        AgentDispatcher dispatcher = new AgentDispatcher(new AgentRegistry(List.of(failing)));

        AgentDispatcher.DispatchResult result = dispatcher.dispatch(Intent.BOOKING_STATUS, context(Intent.BOOKING_STATUS));

        assertThat(result.response().isError()).isTrue();
        assertThat(result.response().getErrorType()).isEqualTo("IllegalStateException");
        assertThat(result.response().getMessage()).doesNotContain("boom");
        assertThat(result.response().getProofs()).containsEntry("trace_id", TRACE_ID);
    }

    @Test
    void nullResponseBecomesErrorEnvelope() {
        AgentDispatcher dispatcher = new AgentDispatcher(new AgentRegistry(List.of(new FixedAgent(Intent.SMALLTALK, null))));

        AgentDispatcher.DispatchResult result = dispatcher.dispatch(Intent.SMALLTALK, context(Intent.SMALLTALK));

        assertThat(result.response().isError()).isTrue();
        assertThat(result.response().getErrorType()).isEqualTo("EmptyAgentResponse");
    }

    @Test
    void agentErrorEnvelopeIsPassedThrough() {
        AgentResponse error = AgentResponse.error("nope", "ValidationError", TRACE_ID, Map.of("missing_field", "terminal"));
        AgentDispatcher dispatcher = new AgentDispatcher(new AgentRegistry(List.of(new FixedAgent(Intent.BOOKING_CREATE, error))));

        AgentResponse response = dispatcher.dispatch(Intent.BOOKING_CREATE, context(Intent.BOOKING_CREATE)).response();

        assertThat(response.isError()).isTrue();
        assertThat(response.getData()).containsEntry("missing_field", "terminal");
    }

    @Test
    void registryRejectsDuplicateAgents() {
        List<Agent> agents = List.of(new FixedAgent(Intent.HELP, null), new FixedAgent(Intent.HELP, null));

        assertThatThrownBy(() -> new AgentRegistry(agents))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("help");
    }

    @Test
    void registryFindsRegisteredIntents() {
        AgentRegistry registry = new AgentRegistry(List.of(new FixedAgent(Intent.HELP, null)));

        assertThat(registry.find(Intent.HELP)).isPresent();
        assertThat(registry.find(Intent.PASSAGE_HISTORY)).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    private static AgentContext context(Intent intent) {
        return AgentContext.builder()
                .message("test")
                .intent(intent)
                .entities(ExtractedEntities.empty())
                .history(List.of())
                .role("ADMIN")
                .traceId(TRACE_ID)
                .build();
    }

    private static class FixedAgent implements Agent {

        private final Intent intent;
        private final AgentResponse response;

        FixedAgent(Intent intent, AgentResponse response) {
            this.intent = intent;
            this.response = response;
        }

        @Override
        public Intent intent() {
            return intent;
        }

        @Override
        public AgentResponse run(AgentContext context) {
            return response;
        }
    }
}
