package com.ai.eligibility.conversation;

/**
 * Result of classifying a confirmation answer.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
