package com.ai.eligibility.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Vehicle section of the intake. Collected in the order brand, model, year, mileage.
 */
@Value
@With
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = CarData.CarDataBuilder.class)
public class CarData {

    public static final CarData EMPTY = CarData.builder().build();

    String brand;
    String model;
    Integer year;
    Integer mileage;

    @JsonIgnore
    public boolean isEmpty() {
        return brand == null && model == null && year == null && mileage == null;
    }

    @JsonIgnore
    public boolean isComplete() {
        return brand != null && model != null && year != null && mileage != null;
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class CarDataBuilder {
    }
}
