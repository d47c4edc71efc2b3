package org.redcap.lite.types;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a raw response string to its category and numeric value.
 *
 * Rules are applied in strict priority order:
 * 1. "" is MISSING with value 0.0
 * 2. a configured missing-data code is CODE
 * 3. a fully numeric string is NUMBER
 * 4. a string matching one of the date formats is DATE
 * 5. anything else is TEXT
 *
 * The missing-code check runs before the numeric parse so that a numeric code
 * such as "-999" is never classified twice.
 */
public final class ValueClassifier {

    // Signed decimal with optional exponent; no whitespace, no NaN/Infinity spellings
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Set<String> missingCodes;
    private final List<DateTimeFormatter> dateFormatters;

    public ValueClassifier(ValueConfig config) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.missingCodes = config.missingCodes();
        this.dateFormatters = config.dateFormats().stream()
                .map(pattern -> DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }

    /**
     * Result of classifying a raw string.
     *
     * @param category     The category
     * @param numericValue The numeric value, NaN for textual categories
     */
    public record Classification(Category category, double numericValue) {

        static final Classification MISSING = new Classification(Category.MISSING, 0.0);

        public Classification {
            Objects.requireNonNull(category, "Category cannot be null");
            if (category.isTextual() != Double.isNaN(numericValue)) {
                throw new IllegalArgumentException(
                        "Numeric value must be NaN exactly for textual categories: " + category + "/" + numericValue);
            }
            if (category == Category.MISSING && numericValue != 0.0) {
                throw new IllegalArgumentException("MISSING values must have numeric value 0.0");
            }
        }
    }

    /**
     * Classifies a raw response value.
     *
     * @throws InputTypeException if raw is null
     */
    public Classification classify(String raw) {
        if (raw == null) {
            throw new InputTypeException("Response values must be strings, got null");
        }
        if (raw.isEmpty()) {
            return Classification.MISSING;
        }
        if (missingCodes.contains(raw)) {
            return new Classification(Category.CODE, Double.NaN);
        }
        if (isNumeric(raw)) {
            return new Classification(Category.NUMBER, Double.parseDouble(raw));
        }
        if (matchesDateFormat(raw)) {
            return new Classification(Category.DATE, Double.NaN);
        }
        return new Classification(Category.TEXT, Double.NaN);
    }

    /**
     * @return true if the string parses fully as a signed decimal number
     */
    public static boolean isNumeric(String raw) {
        return raw != null && NUMERIC.matcher(raw).matches();
    }

    /**
     * Parses a string operand the way REDCap coerces it in arithmetic.
     *
     * @return the parsed number, or NaN if the string is not numeric
     */
    public static double parseNumber(String raw) {
        return isNumeric(raw) ? Double.parseDouble(raw) : Double.NaN;
    }

    private boolean matchesDateFormat(String raw) {
        for (DateTimeFormatter formatter : dateFormatters) {
            if (parses(formatter, raw)) {
                return true;
            }
        }
        return false;
    }

    private static boolean parses(DateTimeFormatter formatter, String raw) {
        try {
            formatter.parse(raw);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
