package com.ai.eligibility.service;

import com.ai.eligibility.conversation.YesNoResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class YesNoClassifierTest {

    private final YesNoClassifier classifier = new YesNoClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"sí", "Si", "  CORRECTO ", "yes", "ok", "Sí, todo bien"})
    void affirmative(String input) {
        assertThat(classifier.classify(input)).isEqualTo(YesNoResult.YES);
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "NO", "no gracias"})
    void negative(String input) {
        assertThat(classifier.classify(input)).isEqualTo(YesNoResult.NO);
    }

    @Test
    @DisplayName("affirmative words win over negative ones")
    void affirmativeCheckedFirst() {
        assertThat(classifier.classify("no sé, creo que sí")).isEqualTo(YesNoResult.YES);
    }

    @Test
    @DisplayName("matching is by substring")
    void substringMatch() {
        // "nombre" contains "no"
        assertThat(classifier.classify("nombre")).isEqualTo(YesNoResult.NO);
    }

    @Test
    void unknown() {
        assertThat(classifier.classify("tal vez")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify("   ")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(YesNoResult.UNKNOWN);
    }
}
