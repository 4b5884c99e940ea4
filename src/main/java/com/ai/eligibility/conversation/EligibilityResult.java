package com.ai.eligibility.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of the three-criterion eligibility check. Reasons are ordered
 * (age, car year, mileage); passing entries start with {@link #PASS_MARK}.
 */
@Value
@Builder
@JsonDeserialize(builder = EligibilityResult.EligibilityResultBuilder.class)
public class EligibilityResult {

    public static final String PASS_MARK = "✓";

    boolean eligible;
    @Singular
    List<String> reasons;
    int age;
    boolean ageOk;
    boolean carAgeOk;
    boolean mileageOk;

    @JsonIgnore
    public List<String> getFailedReasons() {
        return reasons.stream()
                .filter(r -> !r.startsWith(PASS_MARK))
                .collect(Collectors.toList());
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class EligibilityResultBuilder {
    }
}
