package com.ai.eligibility.conversation;

import lombok.Value;

/**
 * Result of the safety pre-filter. {@code reason} is null when the text is safe.
 */
@Value
public class SafetyVerdict {

    private static final SafetyVerdict SAFE = new SafetyVerdict(true, null);

    boolean safe;
    String reason;

    public static SafetyVerdict safe() {
        return SAFE;
    }

    public static SafetyVerdict unsafe(String reason) {
        return new SafetyVerdict(false, reason);
    }
}
