package com.example.threadlog.logs.services;

public class IdGenerationException extends Exception {

    public IdGenerationException(String message) {
        super(message);
    }

    public IdGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
