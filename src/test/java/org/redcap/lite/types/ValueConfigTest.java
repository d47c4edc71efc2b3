package org.redcap.lite.types;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValueConfig - defaults, environment overrides and REDCap's
 * project-info missing-data codes.
 */
class ValueConfigTest {

    @Test
    void defaultsHaveDateFormatsAndNoCodes() {
        ValueConfig config = ValueConfig.defaults();
        assertEquals(ValueConfig.DEFAULT_DATE_FORMATS, config.dateFormats());
        assertTrue(config.missingCodes().isEmpty());
    }

    @Test
    void environmentOverridesCodesAndFormats() {
        ValueConfig config = ValueConfig.fromEnvironment(Map.of(
                ValueConfig.MISSING_CODES_ENV, "NA, UNK ,,-999",
                ValueConfig.DATE_FORMATS_ENV, "dd/MM/uuuu | uuuu-MM-dd"));
        assertEquals(Set.of("NA", "UNK", "-999"), config.missingCodes());
        assertEquals(List.of("dd/MM/uuuu", "uuuu-MM-dd"), config.dateFormats());
    }

    @Test
    void blankEnvironmentFallsBackToDefaults() {
        ValueConfig config = ValueConfig.fromEnvironment(Map.of(ValueConfig.MISSING_CODES_ENV, "  "));
        assertEquals(ValueConfig.defaults(), config);
    }

    @Test
    void parsesProjectInfoMissingDataCodes() {
        assertEquals(List.of("NA", "UNK", "NASK"),
                ValueConfig.parseMissingDataCodes("NA, Not applicable | UNK, Unknown | NASK, Not asked"));
        assertEquals(List.of(), ValueConfig.parseMissingDataCodes(""));
        assertEquals(List.of(), ValueConfig.parseMissingDataCodes(null));
    }

    @Test
    void emptyStringCannotBeACode() {
        assertThrows(IllegalArgumentException.class,
                () -> ValueConfig.defaults().withMissingCodes(List.of("")));
    }

    @Test
    void configIsImmutable() {
        ValueConfig config = ValueConfig.defaults().withMissingCodes(List.of("NA"));
        assertThrows(UnsupportedOperationException.class, () -> config.missingCodes().add("X"));
        assertThrows(UnsupportedOperationException.class, () -> config.dateFormats().add("X"));
    }
}
