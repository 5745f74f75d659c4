package ai.refgraph.graph.usages;

import static org.junit.jupiter.api.Assertions.*;

import ai.refgraph.analyzer.OccurrenceKind;
import ai.refgraph.analyzer.SourceText;
import ai.refgraph.graph.GraphBuilder;
import ai.refgraph.testutil.TestProjects;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UsageFinderTest {
    @TempDir
    Path tempDir;

    @Test
    void testFindUsagesFromGraph() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var graph = new GraphBuilder(project).build(false);

        var hits = new UsageFinder(project).findUsages("greet", graph);
        assertEquals(
                List.of(
                        new UsageHit("pkg/app.py", 6, OccurrenceKind.CALL, "print(greet(\"world\"))"),
                        new UsageHit("pkg/app.py", 7, OccurrenceKind.CALL, "print(greet(\"x\", loud=True))"),
                        new UsageHit("pkg/greeting.py", 6, OccurrenceKind.DEFINITION, "def greet(name, loud=False):"),
                        new UsageHit(
                                "pkg/greeting.py",
                                21,
                                OccurrenceKind.CALL,
                                "return [greet(self.prefix + n) for n in names[:MAX_GREETINGS]]")),
                hits);
    }

    @Test
    void testScanMatchesGraph() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var graph = new GraphBuilder(project).build(false);
        var finder = new UsageFinder(project);

        for (var name : List.of("greet", "Greeter", "greetUser", "MAX_GREETINGS")) {
            assertEquals(finder.findUsages(name, graph), finder.findUsages(name, null), name);
        }
    }

    @Test
    void testCommentsAndStringsAreNotUsages() throws IOException {
        var project = TestProjects.create(tempDir, Map.of("a.py", "# greet\nx = \"greet\"\n"));
        assertTrue(new UsageFinder(project).findUsages("greet", null).isEmpty());
    }

    @Test
    void testUnknownNameHasNoHits() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var graph = new GraphBuilder(project).build(false);
        assertTrue(new UsageFinder(project).findUsages("nowhere", graph).isEmpty());
    }

    @Test
    void testContextIsStrippedAndTruncated() {
        var longLine = "    x = " + "y".repeat(200);
        var context = UsageFinder.context(new SourceText("a\n" + longLine + "\n"), 2);
        assertEquals(UsageFinder.CONTEXT_LIMIT, context.length());
        assertTrue(context.startsWith("x = yyy"));
        assertEquals("a", UsageFinder.context(new SourceText("a\n"), 1));
    }
}
