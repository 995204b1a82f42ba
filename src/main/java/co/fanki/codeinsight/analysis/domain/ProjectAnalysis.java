package co.fanki.codeinsight.analysis.domain;

import co.fanki.codeinsight.shared.DomainException;
import co.fanki.codeinsight.shared.Preconditions;
import co.fanki.codeinsight.shared.ValueObject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of analyzing a whole project tree.
 *
 * <p>Immutable once assembled by the
 * {@link co.fanki.codeinsight.analysis.application.ProjectAnalyzer}; the
 * same instance is handed out by the cache to every caller that asks for
 * the same key.</p>
 *
 * @param projectPath the normalized absolute project root
 * @param files one entry per discovered file, in discovery order
 * @param dependencies the import and export edges
 * @param metrics the aggregated metrics
 * @param architecturePatterns the detected labels, in detection order
 * @param todos every annotation of every file, carrying its file path
 * @param analyzedAt when the analysis finished
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectAnalysis(
        String projectPath,
        List<FileAnalysis> files,
        List<DependencyEdge> dependencies,
        ProjectMetrics metrics,
        List<String> architecturePatterns,
        List<TodoComment> todos,
        Instant analyzedAt
) implements ValueObject {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Validates and copies the collections. */
    public ProjectAnalysis {
        Preconditions.requireNonBlank(projectPath,
                "Project path is required");
        Preconditions.requireNonNull(metrics, "Metrics are required");
        Preconditions.requireNonNull(analyzedAt,
                "Analysis timestamp is required");
        files = files == null ? List.of() : List.copyOf(files);
        dependencies = dependencies == null
                ? List.of() : List.copyOf(dependencies);
        architecturePatterns = architecturePatterns == null
                ? List.of() : List.copyOf(architecturePatterns);
        todos = todos == null ? List.of() : List.copyOf(todos);
    }

    /**
     * Serializes this analysis to the JSON document the dashboards render.
     *
     * @return the JSON representation
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("projectPath", projectPath);
        root.put("analyzedAt", analyzedAt.toString());

        final ArrayNode filesArray = MAPPER.createArrayNode();
        for (final FileAnalysis file : files) {
            final ObjectNode fileObj = MAPPER.createObjectNode();
            fileObj.put("path", file.path());
            fileObj.put("name", file.name());
            fileObj.put("type", file.type());
            fileObj.put("size", file.size());
            fileObj.put("linesOfCode", file.linesOfCode());
            fileObj.set("functions", stringArray(file.functions()));
            fileObj.set("imports", stringArray(file.imports()));
            fileObj.set("exports", stringArray(file.exports()));
            final ArrayNode fileTodos = MAPPER.createArrayNode();
            for (final TodoComment todo : file.todos()) {
                fileTodos.add(todoNode(todo));
            }
            fileObj.set("todos", fileTodos);
            fileObj.put("complexity", file.complexity());
            filesArray.add(fileObj);
        }
        root.set("files", filesArray);

        final ArrayNode depsArray = MAPPER.createArrayNode();
        for (final DependencyEdge edge : dependencies) {
            final ObjectNode edgeObj = MAPPER.createObjectNode();
            edgeObj.put("from", edge.from());
            edgeObj.put("to", edge.to());
            edgeObj.put("type", edge.type().label());
            depsArray.add(edgeObj);
        }
        root.set("dependencies", depsArray);

        final ObjectNode metricsObj = MAPPER.createObjectNode();
        metricsObj.put("totalFiles", metrics.totalFiles());
        metricsObj.put("totalLines", metrics.totalLines());
        metricsObj.put("totalFunctions", metrics.totalFunctions());
        metricsObj.put("avgLinesPerFile", metrics.avgLinesPerFile());
        metricsObj.put("avgComplexity", metrics.avgComplexity());
        metricsObj.set("languages", stringArray(List.copyOf(
                metrics.languages())));
        metricsObj.put("testCoverage", metrics.testCoverage());
        root.set("metrics", metricsObj);

        root.set("architecturePatterns", stringArray(architecturePatterns));

        final ArrayNode todosArray = MAPPER.createArrayNode();
        for (final TodoComment todo : todos) {
            todosArray.add(todoNode(todo));
        }
        root.set("todos", todosArray);

        try {
            return MAPPER.writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to serialize ProjectAnalysis",
                    DomainException.INTERNAL_ERROR, e);
        }
    }

    private static ObjectNode todoNode(final TodoComment todo) {
        final ObjectNode todoObj = MAPPER.createObjectNode();
        todoObj.put("type", todo.type().name());
        todoObj.put("content", todo.content());
        todoObj.put("line", todo.line());
        if (todo.filePath() != null) {
            todoObj.put("file", todo.filePath());
        }
        return todoObj;
    }

    private static ArrayNode stringArray(final List<String> values) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (final String value : values) {
            array.add(value);
        }
        return array;
    }

}
