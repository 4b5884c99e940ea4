package com.ai.eligibility.service;

/**
 * Single-prompt text completion. Implementations call a language model; tests
 * substitute a scripted one.
 */
@FunctionalInterface
public interface TextCompletion {

    /**
     * @param prompt full instruction text sent as one user message
     * @return the model's raw reply, possibly empty
     * @throws TextCompletionException if the model cannot be reached or replies with an unreadable body
     */
    String complete(String prompt);
}
