package co.fanki.codeinsight.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisConfig} and {@link AnalysisDepth}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisConfigTest {

    @Test
    void whenCreatingDefaults_shouldUseDocumentedValues() {
        final AnalysisConfig config = AnalysisConfig.defaults();

        assertFalse(config.includeTests());
        assertEquals(AnalysisDepth.MEDIUM, config.analysisDepth());
        assertEquals(AnalysisConfig.DEFAULT_LANGUAGES, config.languages());
        assertTrue(config.ignorePatterns().isEmpty());
        assertEquals(1024L * 1024L, config.maxFileSize());
    }

    @Test
    void whenSettingLanguages_givenDotsAndCase_shouldNormalize() {
        final AnalysisConfig config = AnalysisConfig.defaults()
                .withLanguages(Arrays.asList(".TS", "ts", " py ", null, ""));

        assertEquals(List.of("ts", "py"), config.languages());
    }

    @Test
    void whenCopying_shouldLeaveSourceUntouched() {
        final AnalysisConfig source = AnalysisConfig.defaults();

        final AnalysisConfig deep = source.withDepth(AnalysisDepth.DEEP)
                .withIncludeTests(true);

        assertEquals(AnalysisDepth.MEDIUM, source.analysisDepth());
        assertEquals(AnalysisDepth.DEEP, deep.analysisDepth());
        assertTrue(deep.includeTests());
    }

    @Test
    void whenCreating_givenNegativeSize_shouldReject() {
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfig.defaults().withMaxFileSize(-1));
    }

    @Test
    void whenParsingDepth_givenUnknownValue_shouldFallBackToMedium() {
        assertEquals(AnalysisDepth.DEEP, AnalysisDepth.fromString("deep"));
        assertEquals(AnalysisDepth.MEDIUM, AnalysisDepth.fromString("full"));
        assertEquals(AnalysisDepth.MEDIUM, AnalysisDepth.fromString(null));
    }

    @Test
    void whenCheckingDepth_shouldBeCumulative() {
        assertFalse(AnalysisDepth.BASIC.extractsStructure());
        assertTrue(AnalysisDepth.MEDIUM.extractsStructure());
        assertFalse(AnalysisDepth.MEDIUM.estimatesComplexity());
        assertTrue(AnalysisDepth.DEEP.extractsStructure());
        assertTrue(AnalysisDepth.DEEP.estimatesComplexity());
    }

}
