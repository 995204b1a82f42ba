package co.fanki.codeinsight;

import co.fanki.codeinsight.analysis.application.CodeAnalysisService;
import co.fanki.codeinsight.analysis.domain.AnalysisConfig;
import co.fanki.codeinsight.analysis.domain.AnalysisDepth;
import co.fanki.codeinsight.analysis.domain.ProjectAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Boots the application context and runs one analysis through it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
class CodeInsightApplicationTest {

    @Autowired
    private CodeAnalysisService service;

    @TempDir
    Path projectDir;

    @Test
    void whenAnalyzing_givenWiredContext_shouldAnalyzeAndCache()
            throws IOException {
        Files.createDirectories(projectDir.resolve("src/controllers"));
        Files.writeString(projectDir.resolve("src/controllers/orders.js"), """
                const express = require('express');
                // FIXME: validate the payload
                function list(req, res) {
                  return res.json(req.query.all ? [] : null);
                }
                module.exports = { list };
                """);

        final AnalysisConfig config = AnalysisConfig.defaults()
                .withDepth(AnalysisDepth.DEEP);
        final ProjectAnalysis analysis = service.analyze(
                projectDir.toString(), config);

        assertEquals(1, analysis.files().size());
        assertEquals(1, analysis.todos().size());
        assertTrue(analysis.files().get(0).imports().contains("express"));
        assertEquals(2, analysis.files().get(0).complexity());
        assertSame(analysis, service.analyze(projectDir.toString(), config));
        assertEquals(1, service.clearCache(projectDir.toString()));
    }

}
