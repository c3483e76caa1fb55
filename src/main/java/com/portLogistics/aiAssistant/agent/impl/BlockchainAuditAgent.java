package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.client.BackendServiceException;
import com.portLogistics.aiAssistant.agent.client.PortBackendClient;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the on-chain proof recorded for a booking. The proof hash is surfaced in {@code proofs}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockchainAuditAgent extends BaseAgent {

    private final PortBackendClient backendClient;

    @Override
    public Intent intent() {
        return Intent.BLOCKCHAIN_AUDIT;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        String traceId = context.getTraceId();
        String bookingRef = context.getEntities().getString(ExtractedEntities.BOOKING_REF);
        if (bookingRef == null) {
            return validationError(
                    "Which booking should I verify on the blockchain?",
                    "Include the booking reference in your message",
                    ExtractedEntities.BOOKING_REF,
                    "Verify booking REF123 on blockchain",
                    traceId);
        }

        try {
            Map<String, Object> proof = backendClient.getBlockchainProof(bookingRef, context.getAuthToken(), traceId);
            boolean verified = Boolean.TRUE.equals(proof.get("verified"));
            log.info("Blockchain proof retrieved - traceId: {}, bookingRef: {}, verified: {}", traceId, bookingRef, verified);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("booking_ref", bookingRef);
            data.put("verified", verified);
            data.put("proof", proof);
            AgentResponse response = successResponse(verified
                    ? "Booking REF" + bookingRef + " is recorded on the blockchain and its record is intact."
                    : "I could not verify booking REF" + bookingRef + " on the blockchain.", data, traceId);

            Map<String, Object> proofs = new LinkedHashMap<>(response.getProofs());
            copyIfPresent(proof, "tx_hash", proofs);
            copyIfPresent(proof, "block_number", proofs);
            return response.toBuilder().proofs(proofs).build();
        } catch (BackendServiceException e) {
            return backendError(e, "booking proof", traceId);
        }
    }

    private static void copyIfPresent(Map<String, Object> source, String key, Map<String, Object> target) {
        Object value = source.get(key);
        if (value != null) {
            target.put(key, value);
        }
    }
}
