package com.ai.supportdesk.exception;

/**
 * Raised while loading support content when it cannot be served safely.
 * Thrown only during start-up, never on conversation traffic.
 */
public class ContentConfigurationException extends RuntimeException {

    public ContentConfigurationException(String message) {
        super(message);
    }

    public ContentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
