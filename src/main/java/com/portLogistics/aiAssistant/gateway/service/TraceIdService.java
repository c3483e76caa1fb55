package com.portLogistics.aiAssistant.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates the per-request trace id returned in {@code proofs.trace_id} and forwarded downstream.
 */
@Service
public class TraceIdService {

    public String generateTraceId() {
        return UUID.randomUUID().toString();
    }
}
