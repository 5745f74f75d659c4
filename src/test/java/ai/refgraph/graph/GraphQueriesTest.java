package ai.refgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import ai.refgraph.analyzer.OccurrenceKind;
import ai.refgraph.analyzer.ParserCapability;
import ai.refgraph.analyzer.SymbolOccurrence;
import ai.refgraph.testutil.TestProjects;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphQueriesTest {
    @TempDir
    Path tempDir;

    private CrossRefGraph graph;

    @BeforeEach
    void setUp() throws IOException {
        graph = new GraphBuilder(TestProjects.copyFixture("testcode-py", tempDir)).build(false);
    }

    @Test
    void testQueryIsExactAndCaseSensitive() {
        assertEquals(4, GraphQueries.query(graph, "greet").size());
        assertTrue(GraphQueries.query(graph, "GREET").isEmpty());
        assertTrue(GraphQueries.query(graph, "gree").isEmpty());
        assertTrue(GraphQueries.query(graph, "doesNotExist").isEmpty());
    }

    @Test
    void testDefinitionsAndUsages() {
        assertEquals(
                List.of(new SymbolOccurrence("pkg/greeting.py", 6, OccurrenceKind.DEFINITION, "greet")),
                GraphQueries.definitions(graph, "greet"));

        var usages = GraphQueries.usages(graph, "greet");
        assertEquals(3, usages.size());
        assertTrue(usages.stream().allMatch(o -> o.kind() == OccurrenceKind.CALL));

        assertEquals(
                List.of(new SymbolOccurrence("pkg/greeting.py", 20, OccurrenceKind.DEFINITION, "greet_all")),
                GraphQueries.definitions(graph, "greet_all"));
        assertEquals(
                List.of(new SymbolOccurrence("pkg/app.py", 9, OccurrenceKind.CALL, "greet_all")),
                GraphQueries.usages(graph, "greet_all"));
    }

    @Test
    void testPrefixSearchIgnoresCaseAndSorts() {
        assertEquals(
                List.of("Greeter", "greet", "greetUser", "greet_all", "greeter"),
                GraphQueries.prefixSearch(graph, "GRE"));
        assertTrue(GraphQueries.prefixSearch(graph, "zzz").isEmpty());
    }

    @Test
    void testSymbolsInFile() {
        var table = GraphQueries.symbolsInFile(graph, "pkg/greeting.py");
        assertEquals(1, table.classes().size());

        var missing = GraphQueries.symbolsInFile(graph, "lib/missing.ts");
        assertTrue(missing.isEmpty());
        assertEquals(ParserCapability.HEURISTIC, missing.confidence());
    }

    @Test
    void testFileSummary() {
        assertEquals(
                "classes: Greeter | functions: greet, __init__, greet_all | vars: MAX_GREETINGS",
                GraphQueries.fileSummary(graph, "pkg/greeting.py"));
        assertEquals("functions: main", GraphQueries.fileSummary(graph, "pkg/app.py"));
        assertEquals("(empty)", GraphQueries.fileSummary(graph, "pkg/__init__.py"));
        assertEquals("(empty)", GraphQueries.fileSummary(graph, "not/indexed.py"));
    }

    @Test
    void testFileSummaryLimitsEachSection() throws IOException {
        var source = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            source.append("def f").append(i).append("():\n    pass\n\n");
        }
        var project = TestProjects.create(tempDir.resolve("many"), Map.of("m.py", source.toString()));
        var many = new GraphBuilder(project).build(false);
        assertEquals("functions: f0, f1, f2, f3, f4, f5, f6, f7", GraphQueries.fileSummary(many, "m.py"));
    }
}
