package com.whereq.memori.exception;

/**
 * Exception thrown when the model answered but the answer is unusable:
 * malformed, unparseable or missing required fields
 */
public class InvalidLlmResponseException extends RuntimeException {
    public InvalidLlmResponseException(String message) {
        super(message);
    }

    public InvalidLlmResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
