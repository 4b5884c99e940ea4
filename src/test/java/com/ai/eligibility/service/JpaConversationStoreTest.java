package com.ai.eligibility.service;

import com.ai.eligibility.component.PiiCipher;
import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.ChatMessage;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.ConversationStep;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.PersonalData;
import com.ai.eligibility.entity.ConversationEntity;
import com.ai.eligibility.repository.ConversationMessageRepository;
import com.ai.eligibility.repository.ConversationRepository;
import com.ai.eligibility.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaConversationStore.class, JpaConversationStoreTest.CipherConfig.class})
class JpaConversationStoreTest {

    @TestConfiguration
    static class CipherConfig {
        @Bean
        PiiCipher piiCipher() {
            return new PiiCipher(PiiCipher.generateKey());
        }
    }

    @Autowired
    private JpaConversationStore store;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private ConversationMessageRepository messageRepository;

    @Autowired
    private TestEntityManager entityManager;

    private static ConversationRecord sample(String id) {
        return ConversationRecord.start(id, Instant.parse("2026-03-15T10:00:00Z")).toBuilder()
                .step(ConversationStep.COMPLETED)
                .personalData(PersonalData.builder().fullName("Juan Pérez").birthYear(1990).email("juan@x.com").build())
                .personalConfirmed(true)
                .carData(CarData.builder().brand("Toyota").model("Corolla").year(2020).mileage(45000).build())
                .carConfirmed(true)
                .eligibilityResult(new EligibilityRule(Fixtures.CLOCK_2026).evaluate(1990, 2020, 45000))
                .updatedAt(Instant.parse("2026-03-15T10:05:00Z"))
                .build()
                .withMessage(ChatMessage.user("Hola"))
                .withMessage(ChatMessage.assistant("¡Hola! ¿Cuál es tu nombre?"))
                .withMessage(ChatMessage.user("Juan Pérez"));
    }

    @Test
    @DisplayName("round trip keeps every field and the message order")
    void roundTrip() {
        ConversationRecord record = sample("c-1");

        store.save(record);
        detach();
        ConversationRecord loaded = store.load("c-1").orElseThrow();

        assertThat(loaded).isEqualTo(record);
        assertThat(loaded.getCreatedAt()).isEqualTo(Instant.parse("2026-03-15T10:00:00Z"));
        assertThat(loaded.getUpdatedAt()).isEqualTo(Instant.parse("2026-03-15T10:05:00Z"));
        assertThat(loaded.getStep()).isEqualTo(ConversationStep.COMPLETED);
        assertThat(loaded.getPersonalData()).isEqualTo(record.getPersonalData());
        assertThat(loaded.getCarData()).isEqualTo(record.getCarData());
        assertThat(loaded.isPersonalConfirmed()).isTrue();
        assertThat(loaded.isCarConfirmed()).isTrue();
        assertThat(loaded.getEligibilityResult()).isEqualTo(record.getEligibilityResult());
        assertThat(loaded.getMessages()).containsExactlyElementsOf(record.getMessages());
    }

    @Test
    @DisplayName("saving a loaded record changes neither its timestamps nor its ciphertext")
    void saveOfLoadedRecordIsNoOp() {
        store.save(sample("c-8"));
        detach();
        ConversationRecord loaded = store.load("c-8").orElseThrow();
        ConversationEntity before = conversationRepository.findById("c-8").orElseThrow();
        String personalCipher = before.getPersonalDataEncrypted();
        String carCipher = before.getCarDataEncrypted();

        store.save(loaded);
        detach();

        assertThat(store.load("c-8").orElseThrow()).isEqualTo(loaded);
        ConversationEntity after = conversationRepository.findById("c-8").orElseThrow();
        assertThat(after.getPersonalDataEncrypted()).isEqualTo(personalCipher);
        assertThat(after.getCarDataEncrypted()).isEqualTo(carCipher);
        assertThat(after.getUpdatedAt()).isEqualTo(Instant.parse("2026-03-15T10:05:00Z"));
    }

    @Test
    @DisplayName("a later save stores the record's new updatedAt")
    void updatedAtFollowsRecord() {
        ConversationRecord record = sample("c-9");
        store.save(record);
        detach();

        store.save(record.withMessage(ChatMessage.assistant("Gracias, Juan."))
                .withUpdatedAt(Instant.parse("2026-03-15T10:10:00Z")));
        detach();

        ConversationRecord loaded = store.load("c-9").orElseThrow();
        assertThat(loaded.getCreatedAt()).isEqualTo(Instant.parse("2026-03-15T10:00:00Z"));
        assertThat(loaded.getUpdatedAt()).isEqualTo(Instant.parse("2026-03-15T10:10:00Z"));
    }

    @Test
    @DisplayName("saving the same record twice stores no extra messages")
    void saveIsIdempotent() {
        ConversationRecord record = sample("c-2");

        store.save(record);
        store.save(record);

        assertThat(messageRepository.countByConversationId("c-2")).isEqualTo(3);
        assertThat(store.load("c-2").orElseThrow().getMessages()).hasSize(3);
    }

    @Test
    @DisplayName("only new messages are appended")
    void appendsNewMessages() {
        ConversationRecord record = sample("c-3");
        store.save(record);

        ConversationRecord next = record.withMessage(ChatMessage.assistant("Gracias, Juan."));
        store.save(next);

        assertThat(store.load("c-3").orElseThrow().getMessages())
                .extracting(ChatMessage::getContent)
                .containsExactly("Hola", "¡Hola! ¿Cuál es tu nombre?", "Juan Pérez", "Gracias, Juan.");
    }

    @Test
    @DisplayName("personal and car data are encrypted at rest")
    void encryptedAtRest() {
        store.save(sample("c-4"));

        ConversationEntity entity = conversationRepository.findById("c-4").orElseThrow();

        assertThat(entity.getPersonalDataEncrypted()).doesNotContain("Juan").doesNotContain("juan@x.com");
        assertThat(entity.getCarDataEncrypted()).doesNotContain("Toyota");
    }

    @Test
    @DisplayName("empty data sections are stored as NULL")
    void emptyDataIsNull() {
        store.save(ConversationRecord.start("c-5", Instant.parse("2026-03-15T10:00:00Z")));

        ConversationEntity entity = conversationRepository.findById("c-5").orElseThrow();
        assertThat(entity.getPersonalDataEncrypted()).isNull();
        assertThat(entity.getCarDataEncrypted()).isNull();
        assertThat(entity.getEligibilityResult()).isNull();

        ConversationRecord loaded = store.load("c-5").orElseThrow();
        assertThat(loaded.getPersonalData()).isEqualTo(PersonalData.EMPTY);
        assertThat(loaded.getCarData()).isEqualTo(CarData.EMPTY);
        assertThat(loaded.getStep()).isEqualTo(ConversationStep.GREETING);
    }

    @Test
    void delete() {
        store.save(sample("c-6"));

        assertThat(store.delete("c-6")).isTrue();
        assertThat(store.load("c-6")).isEmpty();
        assertThat(messageRepository.countByConversationId("c-6")).isZero();
        assertThat(store.delete("c-6")).isFalse();
    }

    @Test
    void unknownId() {
        assertThat(store.load("missing")).isEmpty();
        assertThat(store.delete("missing")).isFalse();
    }

    @Test
    void eligibilityResultKeepsReasons() {
        store.save(sample("c-7"));

        EligibilityResult result = store.load("c-7").orElseThrow().getEligibilityResult();

        assertThat(result.getReasons()).hasSize(3);
        assertThat(result.getAge()).isEqualTo(36);
    }

    private void detach() {
        entityManager.flush();
        entityManager.clear();
    }
}
