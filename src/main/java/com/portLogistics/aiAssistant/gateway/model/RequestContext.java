package com.portLogistics.aiAssistant.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Caller identity and tracking data resolved by the gateway for one request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Trace id generated by the gateway.
     */
    private String traceId;

    /**
     * Role from the X-User-Role header, or from the body when the header is absent.
     */
    private String role;

    /**
     * User id from the X-User-Id header, or from the body when the header is absent.
     */
    private String userId;

    /**
     * Authorization header value, forwarded untouched to backend services.
     */
    private String authToken;

    private String conversationId;

    private Instant receivedAt;
}
