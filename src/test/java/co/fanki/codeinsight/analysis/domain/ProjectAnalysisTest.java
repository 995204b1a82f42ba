package co.fanki.codeinsight.analysis.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ProjectAnalysis}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectAnalysisTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void whenSerializing_shouldWriteEverySection() throws Exception {
        final TodoComment todo = TodoComment.of(TodoType.FIXME,
                "handle refunds", 4);
        final FileAnalysis cart = new FileAnalysis("/p/shop/cart.ts",
                "cart.ts", "ts", 120, 10, List.of("total"), List.of("./tax"),
                List.of("total"), List.of(todo), 3);
        final ProjectMetrics metrics = new ProjectMetrics(1, 10, 1, 10.0, 3.0,
                new TreeSet<>(List.of("ts")), 0);

        final ProjectAnalysis analysis = new ProjectAnalysis("/p/shop",
                List.of(cart),
                List.of(new DependencyEdge("/p/shop/cart.ts", "./tax",
                        EdgeType.IMPORT)),
                metrics, List.of("Module Pattern"),
                List.of(todo.locatedIn("/p/shop/cart.ts")),
                Instant.parse("2024-05-01T10:00:00Z"));

        final JsonNode json = MAPPER.readTree(analysis.toJson());

        assertEquals("/p/shop", json.get("projectPath").asText());
        assertEquals("2024-05-01T10:00:00Z", json.get("analyzedAt").asText());

        final JsonNode file = json.get("files").get(0);
        assertEquals("cart.ts", file.get("name").asText());
        assertEquals(10, file.get("linesOfCode").asInt());
        assertEquals("total", file.get("functions").get(0).asText());
        assertEquals(3, file.get("complexity").asInt());
        assertFalse(file.get("todos").get(0).has("file"));

        final JsonNode edge = json.get("dependencies").get(0);
        assertEquals("./tax", edge.get("to").asText());
        assertEquals("import", edge.get("type").asText());

        assertEquals(10.0, json.get("metrics").get("avgLinesPerFile")
                .asDouble());
        assertEquals("ts", json.get("metrics").get("languages").get(0)
                .asText());
        assertEquals("Module Pattern",
                json.get("architecturePatterns").get(0).asText());

        final JsonNode flattened = json.get("todos").get(0);
        assertEquals("FIXME", flattened.get("type").asText());
        assertEquals(4, flattened.get("line").asInt());
        assertEquals("/p/shop/cart.ts", flattened.get("file").asText());
    }

    @Test
    void whenCreating_givenNullCollections_shouldUseEmptyLists() {
        final ProjectAnalysis analysis = new ProjectAnalysis("/p/shop", null,
                null, ProjectMetrics.empty(), null, null, Instant.EPOCH);

        assertEquals(0, analysis.files().size());
        assertEquals(0, analysis.dependencies().size());
        assertEquals(0, analysis.todos().size());
    }

    @Test
    void whenCreating_givenBlankPath_shouldReject() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProjectAnalysis(" ", List.of(), List.of(),
                        ProjectMetrics.empty(), List.of(), List.of(),
                        Instant.EPOCH));
    }

}
