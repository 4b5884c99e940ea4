package com.ai.eligibility.service;

import com.ai.eligibility.conversation.EligibilityResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;

/**
 * Eligibility decision: applicant at least 18, car from 2015 or later,
 * mileage under 100,000 km. Each criterion is evaluated independently.
 */
@Service
public class EligibilityRule {

    static final int MIN_AGE = 18;
    static final int MIN_CAR_YEAR = 2015;
    static final int MAX_MILEAGE_EXCLUSIVE = 100_000;

    private final Clock clock;

    public EligibilityRule(Clock clock) {
        this.clock = clock;
    }

    public EligibilityResult evaluate(int birthYear, int carYear, int mileage) {
        int age = Year.now(clock).getValue() - birthYear;

        boolean ageOk = age >= MIN_AGE;
        boolean carAgeOk = carYear >= MIN_CAR_YEAR;
        boolean mileageOk = mileage < MAX_MILEAGE_EXCLUSIVE;

        EligibilityResult.EligibilityResultBuilder result = EligibilityResult.builder()
                .eligible(ageOk && carAgeOk && mileageOk)
                .age(age)
                .ageOk(ageOk)
                .carAgeOk(carAgeOk)
                .mileageOk(mileageOk);

        if (ageOk) {
            result.reason(EligibilityResult.PASS_MARK + " Edad: " + age + " años (mayor de 18)");
        } else {
            result.reason("El cliente tiene " + age + " años, debe ser mayor de 18");
        }

        if (carAgeOk) {
            result.reason(EligibilityResult.PASS_MARK + " Año del auto: " + carYear + " (posterior a 2015)");
        } else {
            result.reason("El auto es del año " + carYear + ", debe ser del 2015 o posterior");
        }

        if (mileageOk) {
            result.reason(EligibilityResult.PASS_MARK + " Kilometraje: " + mileage + " km (menor a 100,000 km)");
        } else {
            result.reason("El kilometraje es " + mileage + " km, debe ser menor a 100,000 km");
        }

        return result.build();
    }
}
