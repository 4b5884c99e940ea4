package com.ai.eligibility.service;

import com.ai.eligibility.conversation.ExtractionResult;
import com.ai.eligibility.conversation.SafetyVerdict;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Model-backed extraction for free-text fields (full name, car brand, car model).
 * Every call runs the {@link SafetyFilter} first; a rejected input is never sent
 * for extraction.
 */
@Service
public class LlmFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmFieldExtractor.class);

    static final String NOT_FOUND = "NO_VALIDO";

    private static final String FULL_NAME_PROMPT = "Eres un asistente que extrae nombres completos de mensajes de usuarios.\n\n"
            + "INSTRUCCIONES:\n"
            + "- Extrae SOLO el nombre completo de la persona del siguiente mensaje\n"
            + "- El nombre debe tener al menos 2 palabras (nombre y apellido)\n"
            + "- Capitaliza correctamente: primera letra mayúscula en cada palabra\n"
            + "- NO incluyas títulos, saludos, o palabras adicionales\n"
            + "- Si no hay un nombre claro, responde \"NO_VALIDO\"\n\n"
            + "EJEMPLOS:\n"
            + "- \"Mi nombre es Juan Pérez\" → \"Juan Pérez\"\n"
            + "- \"Me llamo María García López\" → \"María García López\"\n"
            + "- \"Soy Carlos Rodríguez\" → \"Carlos Rodríguez\"\n"
            + "- \"Hola, soy Ana\" → \"NO_VALIDO\" (falta apellido)\n"
            + "- \"hola soy pedro martinez\" → \"Pedro Martinez\"\n\n"
            + "MENSAJE DEL USUARIO:\n"
            + "%s\n\n"
            + "RESPUESTA (solo el nombre completo):";

    private static final String BRAND_PROMPT = "Eres un asistente que extrae marcas de vehículos de mensajes de usuarios.\n\n"
            + "INSTRUCCIONES:\n"
            + "- Extrae SOLO la marca del vehículo del siguiente mensaje\n"
            + "- Debe ser una marca reconocida (Toyota, Ford, Honda, Nissan, Chevrolet, Volkswagen, etc.)\n"
            + "- Usa formato estándar: primera letra mayúscula, resto minúsculas\n"
            + "- NO incluyas el modelo, año, o información adicional\n"
            + "- Si no hay una marca clara, responde \"NO_VALIDO\"\n\n"
            + "EJEMPLOS:\n"
            + "- \"Tengo un Toyota\" → \"Toyota\"\n"
            + "- \"Es un ford focus\" → \"Ford\"\n"
            + "- \"Mi auto es un honda civic\" → \"Honda\"\n"
            + "- \"Es una camioneta chevrolet\" → \"Chevrolet\"\n"
            + "- \"No sé\" → \"NO_VALIDO\"\n\n"
            + "MENSAJE DEL USUARIO:\n"
            + "%s\n\n"
            + "RESPUESTA (solo la marca):";

    private static final String MODEL_PROMPT = "Eres un asistente que extrae modelos de vehículos de mensajes de usuarios.%s\n\n"
            + "INSTRUCCIONES:\n"
            + "- Extrae EXACTAMENTE el modelo que el usuario menciona en su mensaje\n"
            + "- El modelo es la palabra o palabras que el usuario escribió\n"
            + "- Mantén el formato original (mayúsculas/minúsculas, guiones)\n"
            + "- NO inventes modelos, extrae SOLO lo que el usuario escribió\n"
            + "- Si no hay un modelo claro, responde \"NO_VALIDO\"\n\n"
            + "EJEMPLOS DE EXTRACCIÓN:\n"
            + "- Usuario dice \"Es un Civic\" → \"Civic\"\n"
            + "- Usuario dice \"Pulse\" → \"Pulse\"\n"
            + "- Usuario dice \"CR-V\" → \"CR-V\"\n"
            + "- Usuario dice \"Corolla\" → \"Corolla\"\n"
            + "- Usuario dice \"modelo Focus\" → \"Focus\"\n"
            + "- Usuario dice \"No sé\" → \"NO_VALIDO\"\n\n"
            + "MENSAJE DEL USUARIO:\n"
            + "%s\n\n"
            + "RESPUESTA (extrae exactamente lo que el usuario escribió):";

    private final TextCompletion textCompletion;
    private final SafetyFilter safetyFilter;

    public LlmFieldExtractor(TextCompletion textCompletion, SafetyFilter safetyFilter) {
        this.textCompletion = textCompletion;
        this.safetyFilter = safetyFilter;
    }

    /** Accepted only with at least a first name and a last name. */
    public ExtractionResult<String> extractFullName(String userInput) {
        SafetyVerdict verdict = safetyFilter.classify(userInput);
        if (!verdict.isSafe()) {
            return ExtractionResult.unsafe(verdict.getReason());
        }
        String name = extract(String.format(FULL_NAME_PROMPT, userInput));
        if (name == null || name.split(" ").length < 2) {
            return ExtractionResult.missing();
        }
        return ExtractionResult.found(name);
    }

    public ExtractionResult<String> extractBrand(String userInput) {
        SafetyVerdict verdict = safetyFilter.classify(userInput);
        if (!verdict.isSafe()) {
            return ExtractionResult.unsafe(verdict.getReason());
        }
        String brand = extract(String.format(BRAND_PROMPT, userInput));
        if (brand == null) {
            return ExtractionResult.missing();
        }
        return ExtractionResult.found(StringUtils.capitalize(brand.toLowerCase(Locale.ROOT)));
    }

    /**
     * @param brand already collected brand, given to the model as context; may be null
     */
    public ExtractionResult<String> extractModel(String userInput, String brand) {
        SafetyVerdict verdict = safetyFilter.classify(userInput);
        if (!verdict.isSafe()) {
            return ExtractionResult.unsafe(verdict.getReason());
        }
        String brandContext = StringUtils.isNotBlank(brand) ? " La marca del vehículo es " + brand + "." : "";
        String model = extract(String.format(MODEL_PROMPT, brandContext, userInput));
        return model == null ? ExtractionResult.missing() : ExtractionResult.found(model);
    }

    /**
     * Runs the prompt and normalizes whitespace. Returns null for an empty reply,
     * the not-found sentinel, or a failed call.
     */
    private String extract(String prompt) {
        String reply;
        try {
            reply = textCompletion.complete(prompt);
        } catch (RuntimeException ex) {
            log.warn("Field extraction failed: {}", ex.getMessage());
            return null;
        }
        String normalized = StringUtils.normalizeSpace(reply);
        if (StringUtils.isEmpty(normalized) || NOT_FOUND.equals(normalized)) {
            return null;
        }
        return normalized;
    }
}
