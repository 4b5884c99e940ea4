package com.ai.eligibility.controller;

import com.ai.eligibility.conversation.ChatMessage;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.ConversationStep;
import com.ai.eligibility.conversation.PersonalData;
import com.ai.eligibility.service.ConversationOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationOrchestrator orchestrator;

    @Nested
    @DisplayName("POST /api/chat")
    class Chat {

        @Test
        void firstTurn() throws Exception {
            when(orchestrator.processMessage(isNull(), eq("Hola")))
                    .thenReturn(new ConversationOrchestrator.TurnResult("¡Hola!", "c-1", ConversationStep.COLLECTING_PERSONAL));

            mockMvc.perform(post("/api/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"Hola\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.conversationId").value("c-1"))
                    .andExpect(jsonPath("$.response").value("¡Hola!"))
                    .andExpect(jsonPath("$.step").value("COLLECTING_PERSONAL"))
                    .andExpect(jsonPath("$.completed").value(false));
        }

        @Test
        void completedTurn() throws Exception {
            when(orchestrator.processMessage(eq("c-1"), eq("sí")))
                    .thenReturn(new ConversationOrchestrator.TurnResult("¡Buenas noticias!", "c-1", ConversationStep.COMPLETED));

            mockMvc.perform(post("/api/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"conversationId\":\"c-1\",\"message\":\"sí\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.completed").value(true));
        }

        @Test
        @DisplayName("blank message -> 400")
        void blankMessage() throws Exception {
            when(orchestrator.processMessage(any(), any()))
                    .thenThrow(new IllegalArgumentException("Message must not be empty"));

            mockMvc.perform(post("/api/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("bad_request"))
                    .andExpect(jsonPath("$.message").value("Message must not be empty"));
        }

        @Test
        @DisplayName("storage failure -> 503")
        void storageDown() throws Exception {
            when(orchestrator.processMessage(any(), anyString()))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            mockMvc.perform(post("/api/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"Hola\"}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("storage_unavailable"));
        }
    }

    @Nested
    @DisplayName("/api/conversations/{id}")
    class Conversations {

        @Test
        void found() throws Exception {
            ConversationRecord record = ConversationRecord.start("c-1", Instant.parse("2026-03-15T10:00:00Z"))
                    .withStep(ConversationStep.COLLECTING_PERSONAL)
                    .withPersonalData(PersonalData.builder().fullName("Juan Pérez").build())
                    .withMessage(ChatMessage.user("Hola"));
            when(orchestrator.find("c-1")).thenReturn(Optional.of(record));

            mockMvc.perform(get("/api/conversations/c-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.conversationId").value("c-1"))
                    .andExpect(jsonPath("$.step").value("COLLECTING_PERSONAL"))
                    .andExpect(jsonPath("$.personalData.fullName").value("Juan Pérez"))
                    .andExpect(jsonPath("$.messages[0].role").value("user"));
        }

        @Test
        void notFound() throws Exception {
            when(orchestrator.find("nope")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/conversations/nope"))
                    .andExpect(status().isNotFound());
        }

        @Test
        void deleted() throws Exception {
            when(orchestrator.delete("c-1")).thenReturn(true);

            mockMvc.perform(delete("/api/conversations/c-1"))
                    .andExpect(status().isNoContent());
        }

        @Test
        void deleteUnknown() throws Exception {
            when(orchestrator.delete("nope")).thenReturn(false);

            mockMvc.perform(delete("/api/conversations/nope"))
                    .andExpect(status().isNotFound());
        }
    }
}
