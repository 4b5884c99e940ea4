package com.ai.eligibility.service;

import com.ai.eligibility.component.PiiCipher;
import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.ChatMessage;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.PersonalData;
import com.ai.eligibility.entity.ConversationEntity;
import com.ai.eligibility.entity.ConversationMessage;
import com.ai.eligibility.repository.ConversationMessageRepository;
import com.ai.eligibility.repository.ConversationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DB-backed conversation storage. Personal and car data are stored as encrypted JSON;
 * messages are append-only rows ordered by id.
 */
@Service
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);

    private final ConversationRepository conversationRepository;
    private final ConversationMessageRepository messageRepository;
    private final PiiCipher cipher;
    private final ObjectMapper mapper = new ObjectMapper();

    public JpaConversationStore(ConversationRepository conversationRepository,
                                ConversationMessageRepository messageRepository,
                                PiiCipher cipher) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.cipher = cipher;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationRecord> load(String conversationId) {
        if (conversationId == null || conversationId.isEmpty()) return Optional.empty();
        return conversationRepository.findById(conversationId).map(this::toRecord);
    }

    @Override
    @Transactional
    public void save(ConversationRecord record) {
        ConversationEntity entity = conversationRepository.findById(record.getId())
                .orElseGet(() -> ConversationEntity.builder()
                        .id(record.getId())
                        .createdAt(record.getCreatedAt())
                        .build());
        entity.setStep(record.getStep());
        entity.setPersonalDataEncrypted(record.getPersonalData().isEmpty()
                ? null
                : encryptIfChanged(entity.getPersonalDataEncrypted(), record.getPersonalData()));
        entity.setCarDataEncrypted(record.getCarData().isEmpty()
                ? null
                : encryptIfChanged(entity.getCarDataEncrypted(), record.getCarData()));
        entity.setPersonalConfirmed(record.isPersonalConfirmed());
        entity.setCarConfirmed(record.isCarConfirmed());
        entity.setEligibilityResult(record.getEligibilityResult() == null ? null : toJson(record.getEligibilityResult()));
        if (record.getCreatedAt() != null) entity.setCreatedAt(record.getCreatedAt());
        if (record.getUpdatedAt() != null) entity.setUpdatedAt(record.getUpdatedAt());
        conversationRepository.save(entity);

        List<ChatMessage> messages = record.getMessages();
        long stored = messageRepository.countByConversationId(record.getId());
        for (int i = (int) stored; i < messages.size(); i++) {
            ChatMessage m = messages.get(i);
            messageRepository.save(ConversationMessage.builder()
                    .conversationId(record.getId())
                    .role(m.getRole())
                    .content(m.getContent())
                    .build());
        }
        log.debug("[{}] saved step={} messages={}", record.getId(), record.getStep(), messages.size());
    }

    @Override
    @Transactional
    public boolean delete(String conversationId) {
        if (conversationId == null || !conversationRepository.existsById(conversationId)) return false;
        messageRepository.deleteByConversationId(conversationId);
        conversationRepository.deleteById(conversationId);
        log.info("[{}] conversation deleted", conversationId);
        return true;
    }

    private ConversationRecord toRecord(ConversationEntity entity) {
        List<ChatMessage> messages = messageRepository.findByConversationIdOrderByIdAsc(entity.getId()).stream()
                .map(m -> new ChatMessage(m.getRole(), m.getContent()))
                .collect(Collectors.toList());
        return ConversationRecord.builder()
                .id(entity.getId())
                .step(entity.getStep())
                .personalData(entity.getPersonalDataEncrypted() == null
                        ? PersonalData.EMPTY
                        : decryptJson(entity.getPersonalDataEncrypted(), PersonalData.class))
                .personalConfirmed(entity.isPersonalConfirmed())
                .carData(entity.getCarDataEncrypted() == null
                        ? CarData.EMPTY
                        : decryptJson(entity.getCarDataEncrypted(), CarData.class))
                .carConfirmed(entity.isCarConfirmed())
                .eligibilityResult(entity.getEligibilityResult() == null
                        ? null
                        : fromJson(entity.getEligibilityResult(), EligibilityResult.class))
                .messages(List.copyOf(messages))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    /** Reuses the stored ciphertext when it already decrypts to the same JSON. */
    private String encryptIfChanged(String stored, Object value) {
        String json = toJson(value);
        if (stored != null && json.equals(cipher.decrypt(stored))) {
            return stored;
        }
        return cipher.encrypt(json);
    }

    private <T> T decryptJson(String encrypted, Class<T> type) {
        return fromJson(cipher.decrypt(encrypted), type);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read stored " + type.getSimpleName(), e);
        }
    }
}
