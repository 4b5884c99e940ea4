package com.ai.eligibility.service;

import com.ai.eligibility.conversation.YesNoResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Classifies confirmation answers by substring containment.
 * The affirmative set is checked first, so "sí, no hay problema" is YES.
 */
@Service
public class YesNoClassifier {

    private static final List<String> AFFIRMATIVE = List.of("sí", "si", "correcto", "yes", "ok");

    private static final List<String> NEGATIVE = List.of("no");

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase(Locale.ROOT);

        for (String token : AFFIRMATIVE) {
            if (normalized.contains(token)) {
                return YesNoResult.YES;
            }
        }
        for (String token : NEGATIVE) {
            if (normalized.contains(token)) {
                return YesNoResult.NO;
            }
        }
        return YesNoResult.UNKNOWN;
    }
}
