package com.portLogistics.aiAssistant.gateway.controller;

import com.portLogistics.aiAssistant.gateway.dto.ChatRequest;
import com.portLogistics.aiAssistant.gateway.dto.ChatResponse;
import com.portLogistics.aiAssistant.gateway.dto.ClassifierConfigResponse;
import com.portLogistics.aiAssistant.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin HTTP layer for the assistant. Business logic lives in {@link GatewayService}.
 */
@RestController
@RequestMapping("/api/ai/chat")
@RequiredArgsConstructor
public class AssistantController {

    static final String USER_ROLE_HEADER = "X-User-Role";
    static final String USER_ID_HEADER = "X-User-Id";

    private final GatewayService gatewayService;

    /**
     * Chat endpoint.
     *
     * @param request       Chat request body
     * @param authorization Authorization header, forwarded to backend services
     * @param roleHeader    Caller role; overrides the body's userRole
     * @param userIdHeader  Caller id; overrides the body's userId
     * @return Envelope with the resolved intent
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String roleHeader,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {

        ChatResponse response = gatewayService.processChatRequest(request, authorization, roleHeader, userIdHeader);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/config")
    public ResponseEntity<ClassifierConfigResponse> config() {
        return ResponseEntity.ok(gatewayService.getClassifierConfig());
    }
}
