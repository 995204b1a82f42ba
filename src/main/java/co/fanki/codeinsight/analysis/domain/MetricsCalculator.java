package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.Preconditions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Aggregates per-file facts into project metrics and health reports.
 *
 * <p>Deterministic: the result only depends on the set of analyses, not on
 * their order, so two runs over the same tree produce equal metrics.
 * Sums are order independent, languages are sorted and averages are
 * rounded to two decimals with {@link RoundingMode#HALF_UP}.</p>
 *
 * <p>Paths are matched relative to the project root when one is given, so
 * a checkout that happens to live under a {@code test} directory is not
 * mistaken for a test suite.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MetricsCalculator {

    /** Types that count as source code for coverage and documentation. */
    private static final Set<String> CODE_TYPES = Set.of(
            "js", "ts", "jsx", "tsx", "py");

    private static final List<String> TEST_PATH_MARKERS = List.of(
            "/test/", "/tests/", "/__tests__/");

    /**
     * Aggregates the given analyses without a project root.
     *
     * @param files the per-file analyses
     * @return the metrics
     */
    public ProjectMetrics calculateProjectMetrics(
            final List<FileAnalysis> files) {
        return calculateProjectMetrics(null, files);
    }

    /**
     * Aggregates the given analyses.
     *
     * @param projectRoot the absolute project root, or null
     * @param files the per-file analyses
     * @return the metrics
     */
    public ProjectMetrics calculateProjectMetrics(final String projectRoot,
            final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final int totalFiles = files.size();
        int totalLines = 0;
        int totalFunctions = 0;
        long totalComplexity = 0;
        final SortedSet<String> languages = new TreeSet<>();

        for (final FileAnalysis file : files) {
            totalLines += file.linesOfCode();
            totalFunctions += file.functions().size();
            totalComplexity += file.complexity();
            if (!file.type().isEmpty()) {
                languages.add(file.type());
            }
        }

        final double avgLines = totalFiles > 0
                ? round2((double) totalLines / totalFiles) : 0;
        final double avgComplexity = totalFiles > 0
                ? round2((double) totalComplexity / totalFiles) : 0;

        return new ProjectMetrics(totalFiles, totalLines, totalFunctions,
                avgLines, avgComplexity, languages,
                calculateTestCoverage(projectRoot, files));
    }

    /**
     * Computes the heuristic test coverage.
     *
     * <p>A source file counts as tested when the name or path of some test
     * file contains its base name.</p>
     *
     * @param projectRoot the absolute project root, or null
     * @param files the per-file analyses
     * @return the rounded percentage of tested source files, 0 when there
     *     are no source files
     */
    int calculateTestCoverage(final String projectRoot,
            final List<FileAnalysis> files) {
        final List<FileAnalysis> tests = new ArrayList<>();
        final List<FileAnalysis> sources = new ArrayList<>();
        for (final FileAnalysis file : files) {
            if (isTestFile(projectRoot, file)) {
                tests.add(file);
            } else if (CODE_TYPES.contains(file.type())) {
                sources.add(file);
            }
        }
        if (sources.isEmpty()) {
            return 0;
        }

        int tested = 0;
        for (final FileAnalysis source : sources) {
            final String baseName = source.baseName();
            for (final FileAnalysis test : tests) {
                if (test.name().contains(baseName)
                        || relativePath(projectRoot, test)
                                .contains(baseName)) {
                    tested++;
                    break;
                }
            }
        }
        return (int) Math.round(tested * 100.0 / sources.size());
    }

    /**
     * Buckets the files by non-blank line count.
     *
     * @param files the per-file analyses
     * @return the distribution
     */
    public SizeDistribution calculateFileSizeDistribution(
            final List<FileAnalysis> files) {
        int small = 0;
        int medium = 0;
        int large = 0;
        int huge = 0;
        for (final FileAnalysis file : files) {
            final int lines = file.linesOfCode();
            if (lines < 100) {
                small++;
            } else if (lines < 500) {
                medium++;
            } else if (lines < 1000) {
                large++;
            } else {
                huge++;
            }
        }
        return new SizeDistribution(small, medium, large, huge);
    }

    /**
     * Computes the technical-debt index.
     *
     * <p>Each annotation adds its {@link TodoType#debtWeight()}; each
     * complexity point over 10 adds 0.1; each thousand lines over 500 adds
     * 1. The score is averaged over all files.</p>
     *
     * @param files the per-file analyses
     * @return the index rounded to two decimals, 0 when there are no files
     */
    public double calculateTechnicalDebtIndex(
            final List<FileAnalysis> files) {
        if (files.isEmpty()) {
            return 0;
        }
        double debt = 0;
        for (final FileAnalysis file : files) {
            for (final TodoComment todo : file.todos()) {
                debt += todo.type().debtWeight();
            }
            if (file.complexity() > 10) {
                debt += (file.complexity() - 10) * 0.1;
            }
            if (file.linesOfCode() > 500) {
                debt += (file.linesOfCode() - 500) / 1000.0;
            }
        }
        return round2(debt / files.size());
    }

    /**
     * Computes the heuristic quality scores.
     *
     * @param projectRoot the absolute project root, or null
     * @param files the per-file analyses
     * @return the scores, each between 0 and 100
     */
    public CodeQualityScore calculateCodeQualityScore(
            final String projectRoot, final List<FileAnalysis> files) {
        final ProjectMetrics metrics = calculateProjectMetrics(projectRoot,
                files);
        final SizeDistribution sizes = calculateFileSizeDistribution(files);
        final double debt = calculateTechnicalDebtIndex(files);

        final double complexity = Math.max(0,
                100 - metrics.avgComplexity() * 5);
        final double documentation = documentationScore(files);
        final double maintainability = Math.max(0,
                100 - (sizes.huge() * 10 + sizes.large() * 3 + debt));

        final int overall = (int) Math.round(
                (complexity + documentation + maintainability) / 3);

        return new CodeQualityScore(overall, (int) Math.round(complexity),
                (int) Math.round(documentation),
                (int) Math.round(maintainability));
    }

    /**
     * Builds every derived report for the given analyses.
     *
     * @param projectRoot the absolute project root, or null
     * @param files the per-file analyses
     * @return the health report
     */
    public ProjectHealthReport healthReport(final String projectRoot,
            final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");
        return new ProjectHealthReport(
                calculateFileSizeDistribution(files),
                calculateTechnicalDebtIndex(files),
                calculateCodeQualityScore(projectRoot, files));
    }

    private double documentationScore(final List<FileAnalysis> files) {
        double score = 0;
        final boolean hasReadme = files.stream()
                .anyMatch(f -> f.name().toLowerCase().contains("readme"));
        if (hasReadme) {
            score += 30;
        }
        final boolean hasDocs = files.stream()
                .anyMatch(f -> "md".equals(f.type())
                        && !"README.md".equals(f.name()));
        if (hasDocs) {
            score += 20;
        }

        final List<FileAnalysis> code = files.stream()
                .filter(f -> CODE_TYPES.contains(f.type()))
                .toList();
        if (!code.isEmpty()) {
            final long documented = code.stream()
                    .filter(f -> !f.functions().isEmpty()
                            && f.linesOfCode() > 20)
                    .count();
            score += (double) documented / code.size() * 50;
        }
        return Math.min(100, score);
    }

    private static boolean isTestFile(final String projectRoot,
            final FileAnalysis file) {
        if (file.name().contains(".test.") || file.name().contains(".spec.")) {
            return true;
        }
        final String path = relativePath(projectRoot, file);
        for (final String marker : TEST_PATH_MARKERS) {
            if (path.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /** Returns the path with forward slashes, relative to the root if any. */
    private static String relativePath(final String projectRoot,
            final FileAnalysis file) {
        final String path = file.path().replace('\\', '/');
        if (projectRoot == null) {
            return path;
        }
        final String root = projectRoot.replace('\\', '/');
        if (path.startsWith(root + "/")) {
            return path.substring(root.length());
        }
        return path;
    }

    private static double round2(final double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

}
