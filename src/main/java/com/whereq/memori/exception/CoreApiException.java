package com.whereq.memori.exception;

/**
 * Exception thrown when a core REST API call fails
 */
public class CoreApiException extends RuntimeException {

    private final int statusCode;

    public CoreApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CoreApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status of the failed call, 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isServerSide() {
        return statusCode == 0 || statusCode >= 500 || statusCode == 429;
    }
}
