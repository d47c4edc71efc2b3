package org.redcap.lite.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration consumed by the value classifier.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 * - REDCAP_MISSING_CODES: comma-separated missing-data codes (e.g. "NA,UNK")
 * - REDCAP_DATE_FORMATS: '|'-separated DateTimeFormatter patterns, tried in order
 *
 * @param dateFormats  ordered date/time patterns; the first match wins
 * @param missingCodes configured missing-data codes
 */
public record ValueConfig(List<String> dateFormats, Set<String> missingCodes) {

    public static final String MISSING_CODES_ENV = "REDCAP_MISSING_CODES";
    public static final String DATE_FORMATS_ENV = "REDCAP_DATE_FORMATS";

    /**
     * REDCap's date and time text validations, as stored in exports.
     */
    public static final List<String> DEFAULT_DATE_FORMATS = List.of(
            "uuuu-MM-dd",
            "uuuu-MM-dd HH:mm",
            "uuuu-MM-dd HH:mm:ss",
            "HH:mm",
            "HH:mm:ss");

    private static final ValueConfig DEFAULTS = new ValueConfig(DEFAULT_DATE_FORMATS, Set.of());

    public ValueConfig {
        Objects.requireNonNull(dateFormats, "Date formats cannot be null");
        Objects.requireNonNull(missingCodes, "Missing codes cannot be null");
        dateFormats = List.copyOf(dateFormats);
        missingCodes = Set.copyOf(missingCodes);
        if (missingCodes.contains("")) {
            throw new IllegalArgumentException("The empty string cannot be a missing-data code");
        }
    }

    public static ValueConfig defaults() {
        return DEFAULTS;
    }

    public ValueConfig withMissingCodes(Collection<String> codes) {
        return new ValueConfig(dateFormats, new LinkedHashSet<>(codes));
    }

    public ValueConfig withDateFormats(List<String> formats) {
        return new ValueConfig(formats, missingCodes);
    }

    /**
     * Builds a configuration from the process environment, falling back to
     * {@link #defaults()} for anything unset.
     */
    public static ValueConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ValueConfig fromEnvironment(Map<String, String> env) {
        List<String> formats = DEFAULT_DATE_FORMATS;
        String formatsValue = env.get(DATE_FORMATS_ENV);
        if (formatsValue != null && !formatsValue.isBlank()) {
            formats = splitAndTrim(formatsValue, "\\|");
        }

        Set<String> codes = Set.of();
        String codesValue = env.get(MISSING_CODES_ENV);
        if (codesValue != null && !codesValue.isBlank()) {
            codes = new LinkedHashSet<>(splitAndTrim(codesValue, ","));
        }
        return new ValueConfig(formats, codes);
    }

    /**
     * Parses the {@code missing_data_codes} entry of a REDCap project-info
     * export, e.g. {@code "NA, Not applicable | UNK, Unknown"}, into its codes.
     *
     * @param projectInfoValue the raw project-info value; blank means no codes
     * @return the codes in declaration order
     */
    public static List<String> parseMissingDataCodes(String projectInfoValue) {
        if (projectInfoValue == null || projectInfoValue.isBlank()) {
            return List.of();
        }
        List<String> codes = new ArrayList<>();
        for (String entry : projectInfoValue.split("\\|")) {
            String code = entry.split(",", 2)[0].trim();
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        return List.copyOf(codes);
    }

    private static List<String> splitAndTrim(String value, String separatorRegex) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split(separatorRegex)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }
}
