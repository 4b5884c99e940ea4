package com.ai.eligibility.component;

import com.ai.eligibility.conversation.CarData;
import com.ai.eligibility.conversation.PersonalData;
import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Component
public class ResponsePhrases {

    private static final Map<String, String> MODEL_EXAMPLES = Map.ofEntries(
            Map.entry("toyota", "Corolla, Camry, RAV4"),
            Map.entry("honda", "Civic, CR-V, Accord"),
            Map.entry("ford", "Focus, Mustang, F-150"),
            Map.entry("chevrolet", "Cruze, Spark, Silverado"),
            Map.entry("nissan", "Sentra, Versa, Altima"),
            Map.entry("volkswagen", "Golf, Jetta, Tiguan"),
            Map.entry("hyundai", "Elantra, Tucson, Santa Fe"),
            Map.entry("kia", "Rio, Sportage, Sorento"),
            Map.entry("mazda", "Mazda3, CX-5, CX-30"),
            Map.entry("bmw", "Serie 3, X3, X5"),
            Map.entry("mercedes-benz", "Clase C, Clase E, GLC"),
            Map.entry("mercedes", "Clase C, Clase E, GLC"),
            Map.entry("audi", "A3, A4, Q5"),
            Map.entry("subaru", "Impreza, Outback, Forester"),
            Map.entry("jeep", "Wrangler, Cherokee, Grand Cherokee"),
            Map.entry("dodge", "Charger, Challenger, Durango"),
            Map.entry("ram", "1500, 2500, 3500"),
            Map.entry("fiat", "500, Cronos, Pulse"),
            Map.entry("renault", "Sandero, Duster, Kwid"),
            Map.entry("peugeot", "208, 308, 2008"),
            Map.entry("citroen", "C3, C4, Berlingo"),
            Map.entry("mitsubishi", "Lancer, Outlander, L200"),
            Map.entry("suzuki", "Swift, Vitara, Jimny"),
            Map.entry("lexus", "IS, ES, RX"),
            Map.entry("infiniti", "Q50, Q60, QX50"),
            Map.entry("acura", "TLX, MDX, RDX"),
            Map.entry("volvo", "S60, XC60, XC90"),
            Map.entry("land rover", "Range Rover, Discovery, Defender"),
            Map.entry("porsche", "911, Cayenne, Macan"),
            Map.entry("tesla", "Model 3, Model Y, Model S"),
            Map.entry("mini", "Cooper, Countryman, Clubman"),
            Map.entry("seat", "Ibiza, León, Arona"));

    public String greeting() {
        return "¡Hola! Soy el asistente virtual de KoolKars. Estoy aquí para ayudarte a validar la elegibilidad de tu auto "
                + "para nuestro producto. Antes de empezar, ¿podrías darme tu nombre completo?";
    }

    public String askBirthYear(String firstName) {
        if (firstName == null) {
            return "Ahora, ¿cuál es tu año de nacimiento?";
        }
        return "Gracias, " + firstName + ". Ahora, ¿cuál es tu año de nacimiento?";
    }

    public String askEmail() {
        return "Entendido. Finalmente, para enviarte el resumen de tu cotización, ¿cuál es tu dirección de correo electrónico?";
    }

    public String confirmPersonalData(PersonalData data) {
        return "Perfecto! Entonces tengo: nombre " + text(data.getFullName())
                + ", año de nacimiento " + text(data.getBirthYear())
                + " y email " + text(data.getEmail()) + ". Esta todo correcto?";
    }

    public String personalConfirmed(String firstName) {
        return "Perfecto, " + firstName + ". Ya tengo tus datos personales. Ahora necesito información sobre tu vehículo. "
                + "Para empezar, ¿cuál es la marca de tu auto? (Ejemplo: Toyota, Ford, Nissan)";
    }

    public String personalDataReset() {
        return "De acuerdo, empecemos de nuevo. ¿Cuál es tu nombre completo?";
    }

    public String askCarModel(String brand) {
        if (brand == null) {
            return "¿Y cuál es el modelo exacto de tu auto?";
        }
        String examples = modelExamples(brand);
        String question = "¿Y cuál es el modelo exacto de tu " + brand + "?";
        return examples == null ? question : question + " (Ejemplo: " + examples + ")";
    }

    public String askCarYear(String brand, String model) {
        if (model == null) {
            return "Excelente. ¿Qué año es tu " + text(brand) + "?";
        }
        return "Excelente. ¿Qué año es tu " + text(brand) + " " + model + "?";
    }

    public String askMileage() {
        return "Por último, ¿cuál es el kilometraje aproximado actual de tu vehículo?";
    }

    public String confirmCarData(CarData car) {
        int mileage = car.getMileage() == null ? 0 : car.getMileage();
        return "Perfecto! " + text(car.getBrand()) + " " + text(car.getModel())
                + " del " + text(car.getYear()) + " con " + formatMileage(mileage) + "km, correcto?";
    }

    public String carDataReset(String firstName) {
        return "De acuerdo, " + firstName + ". Empecemos de nuevo con los datos del auto. ¿Cuál es la marca de tu auto?";
    }

    public String eligible(String firstName) {
        return "¡Buenas noticias, " + firstName + "! Basado en los criterios iniciales, eres elegible para nuestro producto!";
    }

    public String notEligible(String firstName, List<String> failedReasons) {
        StringBuilder sb = new StringBuilder("Lamentablemente, ")
                .append(firstName)
                .append(", no cumples con los criterios de elegibilidad:");
        for (String reason : failedReasons) {
            sb.append("\n- ").append(reason);
        }
        return sb.toString();
    }

    public String evaluationError() {
        return "Error al evaluar la elegibilidad.";
    }

    public String missingEvaluationData() {
        return "Faltan datos para evaluar la elegibilidad.";
    }

    public String invalidName() {
        return "No pude entender tu nombre. ¿Podrías darme tu nombre completo? (Por ejemplo: Juan Pérez)";
    }

    public String invalidBirthYear() {
        return "No pude entender el año. ¿Podrías darme tu año de nacimiento? (Ejemplo: 1995)";
    }

    public String invalidEmail() {
        return "No pude entender el email. ¿Podrías darme tu dirección de correo electrónico?";
    }

    public String invalidCarBrand() {
        return "No pude entender la marca. ¿Podrías darme la marca de tu auto? (Ejemplo: Toyota, Ford, Honda)";
    }

    public String invalidCarModel(String brand) {
        if (brand == null) {
            return "No pude entender el modelo. ¿Podrías darme el modelo exacto de tu auto?";
        }
        String examples = modelExamples(brand);
        String question = "No pude entender el modelo. ¿Podrías darme el modelo exacto de tu " + brand + "?";
        return examples == null ? question : question + " (Ejemplo: " + examples + ")";
    }

    public String invalidCarYear() {
        return "No pude entender el año. ¿Podrías darme el año de tu vehículo? (Ejemplo: 2018)";
    }

    public String invalidMileage() {
        return "No pude entender el kilometraje. ¿Podrías darme el kilometraje de tu vehículo? (Ejemplo: 45000)";
    }

    public String invalidConfirmation() {
        return "Por favor, responde con 'Sí' o 'No'. ¿Los datos son correctos?";
    }

    public String invalidCarConfirmation() {
        return "Por favor, responde con 'Sí' o 'No'. ¿Los datos del auto son correctos?";
    }

    /**
     * @param expected what the user should send instead, e.g. "tu nombre completo"
     */
    public String unsafeInput(String reason, String expected) {
        return "Tu mensaje contiene contenido inapropiado (" + reason + "). Por favor, proporciona solo " + expected + ".";
    }

    public String modelExamples(String brand) {
        return brand == null ? null : MODEL_EXAMPLES.get(brand.toLowerCase(Locale.ROOT));
    }

    /** 45000 -> "45.000" */
    static String formatMileage(int mileage) {
        DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
        symbols.setGroupingSeparator('.');
        symbols.setDecimalSeparator(',');
        return new DecimalFormat("#,##0", symbols).format(mileage);
    }

    private static String text(Object value) {
        return Objects.toString(value, "");
    }
}
