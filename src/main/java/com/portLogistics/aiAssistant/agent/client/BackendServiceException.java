package com.portLogistics.aiAssistant.agent.client;

import lombok.Getter;

/**
 * Thrown by {@link PortBackendClient} when a backend call fails.
 * Connection failures and timeouts are reported with status 503.
 */
@Getter
public class BackendServiceException extends RuntimeException {

    public static final int SERVICE_UNAVAILABLE = 503;

    private final int statusCode;

    public BackendServiceException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendServiceException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
