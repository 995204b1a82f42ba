package co.fanki.codeinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Insight Application.
 *
 * <p>Boots the static-analysis pipeline: file discovery, per-file pattern
 * extraction, batched execution, metrics, architecture detection and the
 * dependency graph, all reachable through
 * {@link co.fanki.codeinsight.analysis.application.CodeAnalysisService}.
 * HTTP or CLI front ends embed this context and call into that
 * service.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CodeInsightApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeInsightApplication.class, args);
    }

}
