package com.portLogistics.aiAssistant.gateway.exception;

/**
 * Exception thrown when a chat request carries no message field at all.
 */
public class MissingMessageException extends RuntimeException {

    public MissingMessageException(String message) {
        super(message);
    }
}
