package com.ai.eligibility.dto;

import com.ai.eligibility.conversation.ConversationStep;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String conversationId;

    private String response;

    private ConversationStep step;

    private boolean completed;
}
