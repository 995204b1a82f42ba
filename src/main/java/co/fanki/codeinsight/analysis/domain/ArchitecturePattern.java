package co.fanki.codeinsight.analysis.domain;

import java.util.List;
import java.util.function.Predicate;

/**
 * Heuristic architecture labels, in detection order.
 *
 * <p>Each pattern owns an independent predicate over the lower-cased file
 * paths and names of a project. Labels are guesses based on naming, not
 * verified structurally.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ArchitecturePattern {

    COMPONENT_BASED("Component-Based Architecture",
            ctx -> ctx.anyPathOrName("component", "components", "comp",
                    "widget", "widgets", "element", "elements")),

    MVC("MVC Pattern",
            ctx -> ctx.anyPath("model", "models")
                    && ctx.anyPath("view", "views")
                    && ctx.anyPath("controller", "controllers")),

    MICROSERVICES("Microservices Architecture",
            ctx -> ctx.anyPath("service", "services", "api")
                    || ctx.anyName("dockerfile")),

    LAYERED("Layered Architecture",
            ctx -> ctx.countPaths("controller", "service", "repository",
                    "model") >= 2),

    MODULE("Module Pattern",
            ctx -> ctx.files().stream().anyMatch(f -> !f.exports().isEmpty())
                    && ctx.files().stream()
                            .anyMatch(f -> !f.imports().isEmpty())),

    TEST_DRIVEN("Test-Driven Development",
            ctx -> ctx.anyPathOrName("test", "tests", "spec", "__tests__")),

    API_FIRST("API-First Design",
            ctx -> ctx.anyPathOrName("api", "routes", "endpoints", "swagger",
                    "openapi"));

    private final String displayName;

    private final Predicate<Indicators> predicate;

    ArchitecturePattern(final String theDisplayName,
            final Predicate<Indicators> thePredicate) {
        this.displayName = theDisplayName;
        this.predicate = thePredicate;
    }

    /**
     * Returns the label shown to users.
     *
     * @return the display name, e.g. "MVC Pattern"
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether this pattern's indicators are present.
     *
     * @param indicators the project indicators
     * @return true if the pattern is detected
     */
    public boolean matches(final Indicators indicators) {
        return predicate.test(indicators);
    }

    /**
     * Lower-cased paths and names of a project, plus the analyses they
     * came from.
     *
     * @param paths lower-cased paths, relative to the root when known
     * @param names lower-cased file names
     * @param files the analyses
     */
    public record Indicators(
            List<String> paths,
            List<String> names,
            List<FileAnalysis> files
    ) {

        boolean anyPath(final String... indicators) {
            for (final String indicator : indicators) {
                if (paths.stream().anyMatch(p -> p.contains(indicator))) {
                    return true;
                }
            }
            return false;
        }

        boolean anyName(final String... indicators) {
            for (final String indicator : indicators) {
                if (names.stream().anyMatch(n -> n.contains(indicator))) {
                    return true;
                }
            }
            return false;
        }

        boolean anyPathOrName(final String... indicators) {
            return anyPath(indicators) || anyName(indicators);
        }

        int countPaths(final String... indicators) {
            int found = 0;
            for (final String indicator : indicators) {
                if (anyPath(indicator)) {
                    found++;
                }
            }
            return found;
        }
    }

}
