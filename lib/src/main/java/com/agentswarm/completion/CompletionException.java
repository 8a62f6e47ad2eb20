package com.agentswarm.completion;

/**
 * The language completion backend could not produce a response.
 */
public class CompletionException extends Exception {

    private final int statusCode;

    public CompletionException(String message) {
        this(message, -1, null);
    }

    public CompletionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public CompletionException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the backend, or -1 if the failure was not an HTTP error.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
