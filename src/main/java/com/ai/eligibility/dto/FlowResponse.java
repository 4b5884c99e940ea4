package com.ai.eligibility.dto;

import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.PersonalData;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured outcome of one intake turn.
 * No display text: only a type and the payload the renderer needs.
 */
public final class FlowResponse {

    public enum Type {
        GREETING,
        ASK_BIRTH_YEAR,
        ASK_EMAIL,
        CONFIRM_PERSONAL_DATA,
        PERSONAL_CONFIRMED,
        PERSONAL_DATA_RESET,
        INVALID_NAME,
        INVALID_BIRTH_YEAR,
        INVALID_EMAIL,
        INVALID_CONFIRMATION,
        ASK_CAR_MODEL,
        ASK_CAR_YEAR,
        ASK_MILEAGE,
        CONFIRM_CAR_DATA,
        CAR_DATA_RESET,
        INVALID_CAR_BRAND,
        INVALID_CAR_MODEL,
        INVALID_CAR_YEAR,
        INVALID_MILEAGE,
        INVALID_CAR_CONFIRMATION,
        UNSAFE_INPUT,
        MISSING_EVALUATION_DATA,
        ELIGIBILITY_ANNOUNCED,
        NONE
    }

    /** Field names used in {@link Type#UNSAFE_INPUT} payloads. */
    public enum Field {
        FULL_NAME,
        CAR_BRAND,
        CAR_MODEL
    }

    public static final String FIRST_NAME = "firstName";
    public static final String BRAND = "brand";
    public static final String MODEL = "model";
    public static final String PERSONAL_DATA = "personalData";
    public static final String CAR_DATA = "carData";
    public static final String RESULT = "result";
    public static final String REASON = "reason";
    public static final String FIELD = "field";

    private static final FlowResponse NONE = new FlowResponse(Type.NONE, null);

    private final Type type;
    private final Map<String, Object> payload;

    private FlowResponse(Type type, Map<String, Object> payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
    }

    public Type getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public <T> T get(String key, Class<T> type) {
        Object v = payload.get(key);
        return v != null && type.isInstance(v) ? type.cast(v) : null;
    }

    /** True when the turn produced nothing to show and processing should continue. */
    public boolean isSilent() {
        return type == Type.NONE;
    }

    public static FlowResponse of(Type type) {
        return type == Type.NONE ? NONE : new FlowResponse(type, null);
    }

    public static FlowResponse none() {
        return NONE;
    }

    public static FlowResponse askBirthYear(String firstName) {
        return new FlowResponse(Type.ASK_BIRTH_YEAR, Map.of(FIRST_NAME, firstName));
    }

    public static FlowResponse confirmPersonalData(PersonalData snapshot) {
        return new FlowResponse(Type.CONFIRM_PERSONAL_DATA, Map.of(PERSONAL_DATA, snapshot));
    }

    public static FlowResponse personalConfirmed(String firstName) {
        return new FlowResponse(Type.PERSONAL_CONFIRMED, Map.of(FIRST_NAME, firstName));
    }

    public static FlowResponse askCarModel(String brand) {
        return new FlowResponse(Type.ASK_CAR_MODEL, Map.of(BRAND, brand));
    }

    public static FlowResponse askCarYear(String brand, String model) {
        Map<String, Object> p = new HashMap<>();
        p.put(BRAND, brand);
        p.put(MODEL, model);
        return new FlowResponse(Type.ASK_CAR_YEAR, p);
    }

    public static FlowResponse invalidCarModel(String brand) {
        Map<String, Object> p = new HashMap<>();
        if (brand != null) p.put(BRAND, brand);
        return new FlowResponse(Type.INVALID_CAR_MODEL, p);
    }

    public static FlowResponse confirmCarData(CarData snapshot) {
        return new FlowResponse(Type.CONFIRM_CAR_DATA, Map.of(CAR_DATA, snapshot));
    }

    public static FlowResponse carDataReset(String firstName) {
        return new FlowResponse(Type.CAR_DATA_RESET, Map.of(FIRST_NAME, firstName));
    }

    public static FlowResponse unsafeInput(Field field, String reason) {
        Map<String, Object> p = new HashMap<>();
        p.put(FIELD, field);
        p.put(REASON, reason);
        return new FlowResponse(Type.UNSAFE_INPUT, p);
    }

    public static FlowResponse eligibilityAnnounced(EligibilityResult result, String firstName) {
        Map<String, Object> p = new HashMap<>();
        p.put(FIRST_NAME, firstName);
        if (result != null) p.put(RESULT, result);
        return new FlowResponse(Type.ELIGIBILITY_ANNOUNCED, p);
    }

    @Override
    public String toString() {
        return "FlowResponse[" + type + "]";
    }
}
