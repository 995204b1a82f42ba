package co.fanki.codeinsight.analysis.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link LanguageKind}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LanguageKindTest {

    @Test
    void whenResolving_givenScriptExtensions_shouldReturnScript() {
        assertEquals(LanguageKind.SCRIPT, LanguageKind.fromExtension("ts"));
        assertEquals(LanguageKind.SCRIPT, LanguageKind.fromExtension("JSX"));
    }

    @Test
    void whenResolving_givenUnknownExtension_shouldReturnUnknown() {
        assertEquals(LanguageKind.UNKNOWN, LanguageKind.fromExtension("rs"));
        assertEquals(LanguageKind.UNKNOWN, LanguageKind.fromExtension(null));
        assertFalse(LanguageKind.UNKNOWN.isText());
    }

    @Test
    void whenCheckingComplexity_shouldOnlyBeCarriedByCodeKinds() {
        assertTrue(LanguageKind.SCRIPT.rules().complexity().isPresent());
        assertTrue(LanguageKind.PYTHON.rules().complexity().isPresent());
        assertFalse(LanguageKind.MARKUP.rules().complexity().isPresent());
    }

    @Test
    void whenListingTextExtensions_shouldIncludeEveryReadableFormat() {
        assertTrue(LanguageKind.textExtensions().containsAll(
                AnalysisConfig.DEFAULT_LANGUAGES));
        assertTrue(LanguageKind.textExtensions().contains("md"));
        assertTrue(LanguageKind.textExtensions().contains("txt"));
    }

}
