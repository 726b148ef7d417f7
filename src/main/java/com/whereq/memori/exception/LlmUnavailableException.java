package com.whereq.memori.exception;

/**
 * Exception thrown when the model endpoint could not be reached at all:
 * connection refused, timeout, 5xx or rate limited
 */
public class LlmUnavailableException extends RuntimeException {
    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
