package com.example.SmartDairy.exception;

public class TabularExecutionException extends RuntimeException {

    public TabularExecutionException(String message) {
        super(message);
    }

    public TabularExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
