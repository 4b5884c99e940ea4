package com.ai.eligibility.service;

public class TextCompletionException extends RuntimeException {

    public TextCompletionException(String message) {
        super(message);
    }

    public TextCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
