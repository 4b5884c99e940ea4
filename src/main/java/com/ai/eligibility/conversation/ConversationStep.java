package com.ai.eligibility.conversation;

/**
 * Steps of the eligibility intake dialogue, in forward order.
 * Only the two confirmation steps may move backwards (on rejection).
 */
public enum ConversationStep {
    GREETING,
    COLLECTING_PERSONAL,
    CONFIRMING_PERSONAL,
    COLLECTING_CAR,
    CONFIRMING_CAR,
    EVALUATING,
    COMPLETED
}
