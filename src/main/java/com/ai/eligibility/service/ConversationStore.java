package com.ai.eligibility.service;

import com.ai.eligibility.conversation.ConversationRecord;

import java.util.Optional;

/**
 * Persistence seam for conversation records. Implementations keep message order
 * and every field value across a save/load round trip.
 */
public interface ConversationStore {

    Optional<ConversationRecord> load(String conversationId);

    void save(ConversationRecord record);

    /** @return true if a conversation with this id existed */
    boolean delete(String conversationId);
}
