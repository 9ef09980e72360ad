package com.example.SmartDairy.exception;

/**
 * Request-fatal failure of the chat pipeline, typically the persistence layer.
 * Component-level failures never reach this type; they resolve to fallback answers.
 */
public class ChatProcessingException extends RuntimeException {

    public ChatProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Detail text exposed to API callers.
     */
    public String detail() {
        Throwable cause = getCause();
        if (cause == null || cause.getMessage() == null) {
            return getMessage();
        }
        return cause.getMessage();
    }
}
