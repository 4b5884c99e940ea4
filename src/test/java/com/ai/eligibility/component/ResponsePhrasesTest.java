package com.ai.eligibility.component;

import com.ai.eligibility.conversation.CarData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponsePhrasesTest {

    private final ResponsePhrases phrases = new ResponsePhrases();

    @Test
    @DisplayName("mileage uses a dot as thousands separator")
    void mileageFormat() {
        assertThat(ResponsePhrases.formatMileage(45000)).isEqualTo("45.000");
        assertThat(ResponsePhrases.formatMileage(1234567)).isEqualTo("1.234.567");
        assertThat(ResponsePhrases.formatMileage(0)).isEqualTo("0");
    }

    @Test
    void carSummary() {
        CarData car = CarData.builder().brand("Toyota").model("Corolla").year(2020).mileage(45000).build();

        assertThat(phrases.confirmCarData(car)).isEqualTo("Perfecto! Toyota Corolla del 2020 con 45.000km, correcto?");
    }

    @Test
    @DisplayName("model examples are looked up case-insensitively")
    void modelExamples() {
        assertThat(phrases.askCarModel("Toyota"))
                .isEqualTo("¿Y cuál es el modelo exacto de tu Toyota? (Ejemplo: Corolla, Camry, RAV4)");
        assertThat(phrases.askCarModel("Land Rover")).contains("Range Rover, Discovery, Defender");
        assertThat(phrases.askCarModel("Lada")).isEqualTo("¿Y cuál es el modelo exacto de tu Lada?");
    }

    @Test
    void invalidModelWithoutBrand() {
        assertThat(phrases.invalidCarModel(null))
                .isEqualTo("No pude entender el modelo. ¿Podrías darme el modelo exacto de tu auto?");
    }

    @Test
    void notEligibleListsReasons() {
        String text = phrases.notEligible("Juan", List.of("razón uno", "razón dos"));

        assertThat(text).isEqualTo("Lamentablemente, Juan, no cumples con los criterios de elegibilidad:\n"
                + "- razón uno\n"
                + "- razón dos");
    }
}
