package com.ai.eligibility.conversation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationRecordTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @Test
    @DisplayName("builder copies the message list it is given")
    void builderCopiesMessages() {
        List<ChatMessage> messages = new ArrayList<>(List.of(ChatMessage.user("Hola")));
        ConversationRecord record = ConversationRecord.builder().id("c-1").messages(messages).build();

        messages.add(ChatMessage.assistant("¡Hola!"));
        messages.set(0, ChatMessage.user("Adiós"));

        assertThat(record.getMessages()).containsExactly(ChatMessage.user("Hola"));
    }

    @Test
    @DisplayName("withMessages copies the message list it is given")
    void withMessagesCopies() {
        List<ChatMessage> messages = new ArrayList<>();
        ConversationRecord record = ConversationRecord.start("c-2", NOW).withMessages(messages);

        messages.add(ChatMessage.user("Hola"));

        assertThat(record.getMessages()).isEmpty();
        assertThatThrownBy(() -> record.getMessages().add(ChatMessage.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withMessageLeavesOriginalUntouched() {
        ConversationRecord first = ConversationRecord.start("c-3", NOW).withMessage(ChatMessage.user("Hola"));
        ConversationRecord second = first.withMessage(ChatMessage.assistant("¡Hola!"));

        assertThat(first.getMessages()).hasSize(1);
        assertThat(second.getMessages()).hasSize(2);
    }

    @Test
    @DisplayName("unset sections default to their empty values")
    void defaults() {
        ConversationRecord record = ConversationRecord.start("c-4", NOW);

        assertThat(record.getStep()).isEqualTo(ConversationStep.GREETING);
        assertThat(record.getPersonalData()).isEqualTo(PersonalData.EMPTY);
        assertThat(record.getCarData()).isEqualTo(CarData.EMPTY);
        assertThat(record.getMessages()).isEmpty();
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        assertThat(record.getUpdatedAt()).isEqualTo(NOW);
        assertThat(record.firstName()).isEqualTo("Usuario");
    }
}
