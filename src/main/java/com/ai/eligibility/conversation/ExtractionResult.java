package com.ai.eligibility.conversation;

import java.util.Optional;

/**
 * Outcome of extracting one field from free text. A value is present only when
 * the field was recognized; {@code safetyReason} is set only when the safety
 * filter rejected the input before extraction.
 */
public final class ExtractionResult<T> {

    private static final ExtractionResult<?> MISSING = new ExtractionResult<>(null, null);

    private final T value;
    private final String safetyReason;

    private ExtractionResult(T value, String safetyReason) {
        this.value = value;
        this.safetyReason = safetyReason;
    }

    public static <T> ExtractionResult<T> found(T value) {
        return value == null ? missing() : new ExtractionResult<>(value, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> ExtractionResult<T> missing() {
        return (ExtractionResult<T>) MISSING;
    }

    public static <T> ExtractionResult<T> unsafe(String reason) {
        return new ExtractionResult<>(null, reason);
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isUnsafe() {
        return safetyReason != null;
    }

    public String getSafetyReason() {
        return safetyReason;
    }

    @Override
    public String toString() {
        if (isUnsafe()) return "ExtractionResult[unsafe: " + safetyReason + "]";
        return isPresent() ? "ExtractionResult[found]" : "ExtractionResult[missing]";
    }
}
