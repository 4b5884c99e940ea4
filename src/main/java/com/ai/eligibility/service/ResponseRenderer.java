package com.ai.eligibility.service;

import com.ai.eligibility.component.ResponsePhrases;
import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.EligibilityResult;
import com.ai.eligibility.conversation.PersonalData;
import com.ai.eligibility.dto.FlowResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Converts a structured FlowResponse into the assistant's chat text.
 * No flow logic: only type + payload to sentence(s).
 */
@Service
public class ResponseRenderer {

    private static final Logger log = LoggerFactory.getLogger(ResponseRenderer.class);

    private static final String PHRASING_PROMPT = "Eres un asistente virtual amable de KoolKars que ayuda a validar la elegibilidad de autos.\n"
            + "Genera una respuesta natural y amigable basada en el siguiente contexto:\n\n"
            + "%s\n\n"
            + "IMPORTANTE: Mantén la respuesta breve, amigable y profesional. No agregues información extra.\n\n"
            + "Respuesta:";

    private final ResponsePhrases phrases;
    private final TextCompletion textCompletion;
    private final boolean useLlmResponses;

    public ResponseRenderer(ResponsePhrases phrases,
                            TextCompletion textCompletion,
                            @Value("${llm.use-llm-responses:false}") boolean useLlmResponses) {
        this.phrases = phrases;
        this.textCompletion = textCompletion;
        this.useLlmResponses = useLlmResponses;
    }

    public String render(FlowResponse response) {
        if (response == null)
            return "";
        String firstName = response.getString(FlowResponse.FIRST_NAME);
        switch (response.getType()) {
            case GREETING:
                return phrase("El usuario acaba de iniciar la conversación. Debes saludarlo, presentarte como asistente de KoolKars, "
                        + "explicar que ayudarás a validar la elegibilidad de su auto, y pedirle su nombre completo.",
                        phrases.greeting());
            case ASK_BIRTH_YEAR:
                return phrase(firstName != null
                                ? "El usuario se llama " + firstName + ". Agradécele y pídele su año de nacimiento."
                                : "Pídele al usuario su año de nacimiento.",
                        phrases.askBirthYear(firstName));
            case ASK_EMAIL:
                return phrase("El usuario ya dio su año de nacimiento. Pídele su correo electrónico para enviarle el resumen de cotización.",
                        phrases.askEmail());
            case CONFIRM_PERSONAL_DATA:
                return toTextConfirmPersonal(response);
            case PERSONAL_CONFIRMED:
                return phrase("El usuario " + firstName + " confirmó sus datos personales. Ahora debes pedirle información sobre su "
                                + "vehículo, empezando por la marca del auto.",
                        phrases.personalConfirmed(firstName));
            case PERSONAL_DATA_RESET:
                return phrases.personalDataReset();
            case INVALID_NAME:
                return phrases.invalidName();
            case INVALID_BIRTH_YEAR:
                return phrases.invalidBirthYear();
            case INVALID_EMAIL:
                return phrases.invalidEmail();
            case INVALID_CONFIRMATION:
                return phrases.invalidConfirmation();
            case ASK_CAR_MODEL:
                return phrases.askCarModel(response.getString(FlowResponse.BRAND));
            case ASK_CAR_YEAR:
                return phrases.askCarYear(response.getString(FlowResponse.BRAND), response.getString(FlowResponse.MODEL));
            case ASK_MILEAGE:
                return phrases.askMileage();
            case CONFIRM_CAR_DATA:
                CarData car = response.get(FlowResponse.CAR_DATA, CarData.class);
                return phrases.confirmCarData(car != null ? car : CarData.EMPTY);
            case CAR_DATA_RESET:
                return phrases.carDataReset(firstName);
            case INVALID_CAR_BRAND:
                return phrases.invalidCarBrand();
            case INVALID_CAR_MODEL:
                return phrases.invalidCarModel(response.getString(FlowResponse.BRAND));
            case INVALID_CAR_YEAR:
                return phrases.invalidCarYear();
            case INVALID_MILEAGE:
                return phrases.invalidMileage();
            case INVALID_CAR_CONFIRMATION:
                return phrases.invalidCarConfirmation();
            case UNSAFE_INPUT:
                return toTextUnsafe(response);
            case MISSING_EVALUATION_DATA:
                return phrases.missingEvaluationData();
            case ELIGIBILITY_ANNOUNCED:
                return toTextEligibility(response);
            case NONE:
            default:
                return "";
        }
    }

    private String toTextConfirmPersonal(FlowResponse response) {
        PersonalData data = response.get(FlowResponse.PERSONAL_DATA, PersonalData.class);
        if (data == null)
            data = PersonalData.EMPTY;
        String context = "Confirma los datos personales: nombre=" + StringUtils.defaultString(data.getFullName())
                + ", año de nacimiento=" + (data.getBirthYear() != null ? data.getBirthYear() : "")
                + ", email=" + StringUtils.defaultString(data.getEmail()) + ". Pregunta si son correctos.";
        return phrase(context, phrases.confirmPersonalData(data));
    }

    private String toTextUnsafe(FlowResponse response) {
        FlowResponse.Field field = response.get(FlowResponse.FIELD, FlowResponse.Field.class);
        String expected;
        if (field == FlowResponse.Field.CAR_BRAND)
            expected = "la marca de tu auto";
        else if (field == FlowResponse.Field.CAR_MODEL)
            expected = "el modelo de tu auto";
        else
            expected = "tu nombre completo";
        return phrases.unsafeInput(response.getString(FlowResponse.REASON), expected);
    }

    private String toTextEligibility(FlowResponse response) {
        EligibilityResult result = response.get(FlowResponse.RESULT, EligibilityResult.class);
        if (result == null)
            return phrases.evaluationError();
        String firstName = response.getString(FlowResponse.FIRST_NAME);
        if (result.isEligible()) {
            return phrase("El usuario " + firstName + " ES ELEGIBLE para el producto. Dale las buenas noticias de forma entusiasta.",
                    phrases.eligible(firstName));
        }
        return phrase("El usuario " + firstName + " NO ES ELEGIBLE. Razones: " + String.join(", ", result.getFailedReasons())
                        + ". Informa de forma empática.",
                phrases.notEligible(firstName, result.getFailedReasons()));
    }

    /**
     * Model-generated phrasing when enabled; the template is returned when disabled,
     * on an empty reply, or when the call fails.
     */
    private String phrase(String context, String template) {
        if (!useLlmResponses)
            return template;
        try {
            String generated = StringUtils.trim(textCompletion.complete(String.format(PHRASING_PROMPT, context)));
            return StringUtils.isNotEmpty(generated) ? generated : template;
        } catch (RuntimeException ex) {
            log.warn("Response phrasing failed, using template: {}", ex.getMessage());
            return template;
        }
    }
}
