package com.ai.eligibility.dto;

import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.ChatMessage;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.ConversationStep;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.PersonalData;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a stored conversation, as returned by the REST API.
 */
@Value
@Builder
public class ConversationView {

    String conversationId;
    ConversationStep step;
    PersonalData personalData;
    boolean personalConfirmed;
    CarData carData;
    boolean carConfirmed;
    EligibilityResult eligibilityResult;
    List<ChatMessage> messages;
    Instant createdAt;
    Instant updatedAt;

    public static ConversationView from(ConversationRecord record) {
        return ConversationView.builder()
                .conversationId(record.getId())
                .step(record.getStep())
                .personalData(record.getPersonalData())
                .personalConfirmed(record.isPersonalConfirmed())
                .carData(record.getCarData())
                .carConfirmed(record.isCarConfirmed())
                .eligibilityResult(record.getEligibilityResult())
                .messages(record.getMessages())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
