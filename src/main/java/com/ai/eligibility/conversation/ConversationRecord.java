package com.ai.eligibility.conversation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The persisted unit of a conversation. Immutable: every state change produces
 * a new instance through {@link #toBuilder()} or one of the {@code with} methods.
 */
@Value
@With
public class ConversationRecord {

    @NonNull
    String id;

    @NonNull
    ConversationStep step;

    @NonNull
    PersonalData personalData;

    boolean personalConfirmed;

    @NonNull
    CarData carData;

    boolean carConfirmed;

    EligibilityResult eligibilityResult;

    @NonNull
    List<ChatMessage> messages;

    Instant createdAt;

    Instant updatedAt;

    /** Unset sections fall back to their empty values; {@code messages} is copied. */
    @Builder(toBuilder = true)
    public ConversationRecord(@NonNull String id, ConversationStep step, PersonalData personalData,
                              boolean personalConfirmed, CarData carData, boolean carConfirmed,
                              EligibilityResult eligibilityResult, List<ChatMessage> messages,
                              Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.step = step == null ? ConversationStep.GREETING : step;
        this.personalData = personalData == null ? PersonalData.EMPTY : personalData;
        this.personalConfirmed = personalConfirmed;
        this.carData = carData == null ? CarData.EMPTY : carData;
        this.carConfirmed = carConfirmed;
        this.eligibilityResult = eligibilityResult;
        this.messages = messages == null ? List.of() : List.copyOf(messages);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static ConversationRecord start(String id, Instant now) {
        return ConversationRecord.builder()
                .id(id)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** Returns a copy with {@code message} appended; the message list never shrinks. */
    public ConversationRecord withMessage(ChatMessage message) {
        List<ChatMessage> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return toBuilder().messages(next).build();
    }

    public String firstName() {
        String fullName = personalData.getFullName();
        if (fullName == null || fullName.isBlank()) {
            return "Usuario";
        }
        return fullName.trim().split("\\s+")[0];
    }
}
