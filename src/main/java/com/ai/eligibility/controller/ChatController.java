package com.ai.eligibility.controller;

import com.ai.eligibility.dto.ChatRequest;
import com.ai.eligibility.dto.ChatResponse;
import com.ai.eligibility.dto.ConversationView;
import com.ai.eligibility.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ConversationOrchestrator orchestrator;

    public ChatController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/chat")
    public ChatResponse chat(@RequestBody ChatRequest request) {
        ConversationOrchestrator.TurnResult result =
                orchestrator.processMessage(request.getConversationId(), request.getMessage());
        return new ChatResponse(result.getConversationId(), result.getResponse(), result.getStep(), result.isCompleted());
    }

    @GetMapping("/conversations/{id}")
    public ResponseEntity<ConversationView> get(@PathVariable("id") String id) {
        return orchestrator.find(id)
                .map(ConversationView::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/conversations/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        if (!orchestrator.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        log.info("[{}] deleted via API", id);
        return ResponseEntity.noContent().build();
    }
}
