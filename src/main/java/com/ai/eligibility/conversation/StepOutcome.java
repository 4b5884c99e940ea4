package com.ai.eligibility.conversation;

import com.ai.eligibility.dto.FlowResponse;
import lombok.Value;

/**
 * What one processing pass produced: the next record and the single event to show.
 */
@Value
public class StepOutcome {

    ConversationRecord record;
    FlowResponse response;

    public static StepOutcome of(ConversationRecord record, FlowResponse response) {
        return new StepOutcome(record, response);
    }
}
