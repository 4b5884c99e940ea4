package com.ai.eligibility.service;

import com.ai.eligibility.conversation.ChatMessage;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.ConversationStep;
import com.ai.eligibility.conversation.StepOutcome;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry for a user turn: load, run the state machine, render, save.
 * Turns on the same conversation id are serialized.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final IntakeStateMachine stateMachine;
    private final ResponseRenderer renderer;
    private final ConversationStore store;
    private final Clock clock;

    private final ConcurrentMap<String, TurnLock> locks = new ConcurrentHashMap<>();

    public ConversationOrchestrator(IntakeStateMachine stateMachine,
                                    ResponseRenderer renderer,
                                    ConversationStore store,
                                    Clock clock) {
        this.stateMachine = stateMachine;
        this.renderer = renderer;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Processes one user message.
     *
     * @param conversationId existing id, or null/blank to start a new conversation
     * @throws IllegalArgumentException if the message is blank
     */
    public TurnResult processMessage(String conversationId, String userText) {
        if (StringUtils.isBlank(userText)) {
            throw new IllegalArgumentException("Message must not be empty");
        }
        String id = StringUtils.isBlank(conversationId) ? UUID.randomUUID().toString() : conversationId.trim();

        TurnLock lock = acquire(id);
        try {
            Instant now = clock.instant();
            ConversationRecord record = store.load(id)
                    .orElseGet(() -> {
                        log.info("[{}] new conversation", id);
                        return ConversationRecord.start(id, now);
                    });
            record = record.withMessage(ChatMessage.user(userText));

            StepOutcome outcome = stateMachine.process(record, userText);
            String response = renderer.render(outcome.getResponse());

            ConversationRecord next = outcome.getRecord().withUpdatedAt(now);
            if (!response.isEmpty()) {
                next = next.withMessage(ChatMessage.assistant(response));
            }
            store.save(next);
            log.info("[{}] turn handled: event={} step={}", id, outcome.getResponse().getType(), next.getStep());
            return new TurnResult(response, id, next.getStep());
        } finally {
            release(id, lock);
        }
    }

    private TurnLock acquire(String id) {
        TurnLock lock = locks.compute(id, (k, existing) -> {
            TurnLock l = existing != null ? existing : new TurnLock();
            l.users++;
            return l;
        });
        lock.lock();
        return lock;
    }

    // Entry is dropped once no thread holds or waits for it.
    private void release(String id, TurnLock lock) {
        lock.unlock();
        locks.computeIfPresent(id, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class TurnLock extends ReentrantLock {
        // guarded by the map's compute
        private int users;
    }

    public Optional<ConversationRecord> find(String conversationId) {
        return store.load(conversationId);
    }

    public boolean delete(String conversationId) {
        return store.delete(conversationId);
    }

    public static final class TurnResult {
        private final String response;
        private final String conversationId;
        private final ConversationStep step;

        public TurnResult(String response, String conversationId, ConversationStep step) {
            this.response = response != null ? response : "";
            this.conversationId = conversationId;
            this.step = step;
        }

        public String getResponse() {
            return response;
        }

        public String getConversationId() {
            return conversationId;
        }

        public ConversationStep getStep() {
            return step;
        }

        public boolean isCompleted() {
            return step == ConversationStep.COMPLETED;
        }
    }
}
