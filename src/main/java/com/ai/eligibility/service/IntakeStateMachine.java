package com.ai.eligibility.service;

import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.ConversationRecord;
import com.ai.eligibility.conversation.ConversationStep;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.ExtractionResult;
import com.ai.eligibility.conversation.PersonalData;
import com.ai.eligibility.conversation.StepOutcome;
import com.ai.eligibility.dto.FlowResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives the intake dialogue. Each call handles one user turn: it picks the
 * handler for the current step, returns the updated record and the single
 * event the renderer turns into text. Never calls storage.
 */
@Service
public class IntakeStateMachine {

    private static final Logger log = LoggerFactory.getLogger(IntakeStateMachine.class);

    private final PatternFieldExtractor patternExtractor;
    private final LlmFieldExtractor llmExtractor;
    private final YesNoClassifier yesNoClassifier;
    private final EligibilityRule eligibilityRule;

    public IntakeStateMachine(PatternFieldExtractor patternExtractor,
                              LlmFieldExtractor llmExtractor,
                              YesNoClassifier yesNoClassifier,
                              EligibilityRule eligibilityRule) {
        this.patternExtractor = patternExtractor;
        this.llmExtractor = llmExtractor;
        this.yesNoClassifier = yesNoClassifier;
        this.eligibilityRule = eligibilityRule;
    }

    /**
     * Processes one user turn. A silent event on the way into EVALUATING or
     * COMPLETED is followed by another dispatch, so confirming the car data
     * yields the eligibility announcement in the same call.
     */
    public StepOutcome process(ConversationRecord record, String userInput) {
        StepOutcome outcome = dispatch(record, userInput);
        while (outcome.getResponse().isSilent() && isAutomatic(outcome.getRecord().getStep())) {
            outcome = dispatch(outcome.getRecord(), userInput);
        }
        return outcome;
    }

    private static boolean isAutomatic(ConversationStep step) {
        return step == ConversationStep.EVALUATING || step == ConversationStep.COMPLETED;
    }

    private StepOutcome dispatch(ConversationRecord record, String userInput) {
        ConversationStep from = record.getStep();
        StepOutcome outcome = switch (from) {
            case GREETING -> greet(record);
            case COLLECTING_PERSONAL -> collectPersonal(record, userInput);
            case CONFIRMING_PERSONAL -> confirmPersonal(record, userInput);
            case COLLECTING_CAR -> collectCar(record, userInput);
            case CONFIRMING_CAR -> confirmCar(record, userInput);
            case EVALUATING -> evaluate(record);
            case COMPLETED -> announce(record);
        };
        ConversationStep to = outcome.getRecord().getStep();
        if (from != to) {
            log.info("[{}] step {} -> {}", record.getId(), from, to);
        }
        return outcome;
    }

    private StepOutcome greet(ConversationRecord record) {
        return StepOutcome.of(record.withStep(ConversationStep.COLLECTING_PERSONAL),
                FlowResponse.of(FlowResponse.Type.GREETING));
    }

    private StepOutcome collectPersonal(ConversationRecord record, String userInput) {
        PersonalData data = record.getPersonalData();

        if (data.getFullName() == null) {
            ExtractionResult<String> name = llmExtractor.extractFullName(userInput);
            if (name.isUnsafe()) {
                return rejectUnsafe(record, FlowResponse.Field.FULL_NAME, name);
            }
            if (!name.isPresent()) {
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_NAME));
            }
            ConversationRecord next = record.withPersonalData(data.withFullName(name.getValue().get()));
            return StepOutcome.of(next, FlowResponse.askBirthYear(next.firstName()));
        }

        if (data.getBirthYear() == null) {
            ExtractionResult<Integer> year = patternExtractor.extractBirthYear(userInput);
            if (!year.isPresent()) {
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_BIRTH_YEAR));
            }
            return StepOutcome.of(record.withPersonalData(data.withBirthYear(year.getValue().get())),
                    FlowResponse.of(FlowResponse.Type.ASK_EMAIL));
        }

        ExtractionResult<String> email = patternExtractor.extractEmail(userInput);
        if (!email.isPresent()) {
            return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_EMAIL));
        }
        PersonalData filled = data.withEmail(email.getValue().get());
        return StepOutcome.of(record.toBuilder()
                        .personalData(filled)
                        .step(ConversationStep.CONFIRMING_PERSONAL)
                        .build(),
                FlowResponse.confirmPersonalData(filled));
    }

    private StepOutcome confirmPersonal(ConversationRecord record, String userInput) {
        switch (yesNoClassifier.classify(userInput)) {
            case YES:
                return StepOutcome.of(record.toBuilder()
                                .personalConfirmed(true)
                                .step(ConversationStep.COLLECTING_CAR)
                                .build(),
                        FlowResponse.personalConfirmed(record.firstName()));
            case NO:
                return StepOutcome.of(record.toBuilder()
                                .personalData(PersonalData.EMPTY)
                                .personalConfirmed(false)
                                .step(ConversationStep.COLLECTING_PERSONAL)
                                .build(),
                        FlowResponse.of(FlowResponse.Type.PERSONAL_DATA_RESET));
            default:
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_CONFIRMATION));
        }
    }

    private StepOutcome collectCar(ConversationRecord record, String userInput) {
        CarData car = record.getCarData();

        if (car.getBrand() == null) {
            ExtractionResult<String> brand = llmExtractor.extractBrand(userInput);
            if (brand.isUnsafe()) {
                return rejectUnsafe(record, FlowResponse.Field.CAR_BRAND, brand);
            }
            if (!brand.isPresent()) {
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_CAR_BRAND));
            }
            String value = brand.getValue().get();
            return StepOutcome.of(record.withCarData(car.withBrand(value)), FlowResponse.askCarModel(value));
        }

        if (car.getModel() == null) {
            ExtractionResult<String> model = llmExtractor.extractModel(userInput, car.getBrand());
            if (model.isUnsafe()) {
                return rejectUnsafe(record, FlowResponse.Field.CAR_MODEL, model);
            }
            if (!model.isPresent()) {
                return StepOutcome.of(record, FlowResponse.invalidCarModel(car.getBrand()));
            }
            String value = model.getValue().get();
            return StepOutcome.of(record.withCarData(car.withModel(value)),
                    FlowResponse.askCarYear(car.getBrand(), value));
        }

        if (car.getYear() == null) {
            ExtractionResult<Integer> year = patternExtractor.extractCarYear(userInput);
            if (!year.isPresent()) {
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_CAR_YEAR));
            }
            return StepOutcome.of(record.withCarData(car.withYear(year.getValue().get())),
                    FlowResponse.of(FlowResponse.Type.ASK_MILEAGE));
        }

        ExtractionResult<Integer> mileage = patternExtractor.extractMileage(userInput);
        if (!mileage.isPresent()) {
            return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_MILEAGE));
        }
        CarData filled = car.withMileage(mileage.getValue().get());
        return StepOutcome.of(record.toBuilder()
                        .carData(filled)
                        .step(ConversationStep.CONFIRMING_CAR)
                        .build(),
                FlowResponse.confirmCarData(filled));
    }

    private StepOutcome confirmCar(ConversationRecord record, String userInput) {
        switch (yesNoClassifier.classify(userInput)) {
            case YES:
                return StepOutcome.of(record.toBuilder()
                                .carConfirmed(true)
                                .step(ConversationStep.EVALUATING)
                                .build(),
                        FlowResponse.none());
            case NO:
                return StepOutcome.of(record.toBuilder()
                                .carData(CarData.EMPTY)
                                .carConfirmed(false)
                                .step(ConversationStep.COLLECTING_CAR)
                                .build(),
                        FlowResponse.carDataReset(record.firstName()));
            default:
                return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.INVALID_CAR_CONFIRMATION));
        }
    }

    private StepOutcome evaluate(ConversationRecord record) {
        Integer birthYear = record.getPersonalData().getBirthYear();
        Integer carYear = record.getCarData().getYear();
        Integer mileage = record.getCarData().getMileage();
        if (birthYear == null || carYear == null || mileage == null) {
            log.error("[{}] evaluation reached without birth year, car year or mileage", record.getId());
            return StepOutcome.of(record, FlowResponse.of(FlowResponse.Type.MISSING_EVALUATION_DATA));
        }
        EligibilityResult result = eligibilityRule.evaluate(birthYear, carYear, mileage);
        log.info("[{}] eligibility evaluated: eligible={}", record.getId(), result.isEligible());
        return StepOutcome.of(record.toBuilder()
                        .eligibilityResult(result)
                        .step(ConversationStep.COMPLETED)
                        .build(),
                FlowResponse.none());
    }

    private StepOutcome announce(ConversationRecord record) {
        return StepOutcome.of(record, FlowResponse.eligibilityAnnounced(record.getEligibilityResult(), record.firstName()));
    }

    private StepOutcome rejectUnsafe(ConversationRecord record, FlowResponse.Field field, ExtractionResult<?> result) {
        log.warn("[{}] input rejected by safety filter while collecting {}", record.getId(), field);
        return StepOutcome.of(record, FlowResponse.unsafeInput(field, result.getSafetyReason()));
    }
}
