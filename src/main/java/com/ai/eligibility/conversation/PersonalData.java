package com.ai.eligibility.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Identity section of the intake. Collected in the order fullName, birthYear, email.
 */
@Value
@With
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = PersonalData.PersonalDataBuilder.class)
public class PersonalData {

    public static final PersonalData EMPTY = PersonalData.builder().build();

    String fullName;
    Integer birthYear;
    String email;

    @JsonIgnore
    public boolean isEmpty() {
        return fullName == null && birthYear == null && email == null;
    }

    @JsonIgnore
    public boolean isComplete() {
        return fullName != null && birthYear != null && email != null;
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class PersonalDataBuilder {
    }
}
