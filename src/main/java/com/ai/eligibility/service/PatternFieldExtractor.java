package com.ai.eligibility.service;

import com.ai.eligibility.conversation.ExtractionResult;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction for structured fields (years, email, mileage).
 * These fields do not go through the safety filter.
 */
@Service
public class PatternFieldExtractor {

    public static final int MIN_BIRTH_YEAR = 1900;
    public static final int MAX_BIRTH_YEAR = 2010;
    public static final int MIN_CAR_YEAR = 2000;
    public static final int MAX_CAR_YEAR = 2025;
    public static final int MIN_MILEAGE = 0;
    public static final int MAX_MILEAGE = 500_000;

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

    private static final Pattern EMAIL = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern MILEAGE = Pattern.compile("\\b\\d{1,6}\\b");

    public ExtractionResult<Integer> extractBirthYear(String text) {
        return extractYear(text, MIN_BIRTH_YEAR, MAX_BIRTH_YEAR);
    }

    public ExtractionResult<Integer> extractCarYear(String text) {
        return extractYear(text, MIN_CAR_YEAR, MAX_CAR_YEAR);
    }

    /** First 19xx/20xx token, accepted only when it falls in [min, max]. */
    public ExtractionResult<Integer> extractYear(String text, int min, int max) {
        if (text == null) return ExtractionResult.missing();
        Matcher m = YEAR.matcher(text);
        if (!m.find()) return ExtractionResult.missing();
        int year = Integer.parseInt(m.group());
        return year >= min && year <= max ? ExtractionResult.found(year) : ExtractionResult.missing();
    }

    public ExtractionResult<String> extractEmail(String text) {
        if (text == null) return ExtractionResult.missing();
        Matcher m = EMAIL.matcher(text);
        return m.find() ? ExtractionResult.found(m.group()) : ExtractionResult.missing();
    }

    /** Thousands separators are dropped before matching, so "45.000 km" reads as 45000. */
    public ExtractionResult<Integer> extractMileage(String text) {
        if (text == null) return ExtractionResult.missing();
        String cleaned = text.replace(".", "").replace(",", "");
        Matcher m = MILEAGE.matcher(cleaned);
        if (!m.find()) return ExtractionResult.missing();
        int mileage = Integer.parseInt(m.group());
        return mileage >= MIN_MILEAGE && mileage <= MAX_MILEAGE
                ? ExtractionResult.found(mileage)
                : ExtractionResult.missing();
    }
}
