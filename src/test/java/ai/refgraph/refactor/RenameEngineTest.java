package ai.refgraph.refactor;

import static org.junit.jupiter.api.Assertions.*;

import ai.refgraph.graph.GraphBuilder;
import ai.refgraph.testutil.TestProjects;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RenameEngineTest {
    @TempDir
    Path tempDir;

    @Test
    void testRenameRewritesEveryReference() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result = new RenameEngine(project).rename("greet", "hello", false);

        assertTrue(result.applied());
        assertTrue(result.errors().isEmpty());
        assertEquals(5, result.edits().size());
        assertEquals(Set.of("pkg/app.py", "pkg/greeting.py"), result.filesAffected());
        assertTrue(result.edits().contains(
                new Edit("pkg/app.py", 6, 10, 15, "greet", "hello", "print(greet(\"world\"))")));

        var graph = new GraphBuilder(project).build(false);
        assertTrue(graph.occurrencesOf("greet").isEmpty());
        assertEquals(4, graph.occurrencesOf("hello").size());

        var app = Files.readString(tempDir.resolve("pkg/app.py"));
        assertTrue(app.startsWith("from pkg.greeting import hello, Greeter\n"), app);
        // comments, strings and longer names are left alone
        assertTrue(app.contains("# greet the world first"));
        assertTrue(app.contains("greeter.greet_all("));
        var greeting = Files.readString(tempDir.resolve("pkg/greeting.py"));
        assertTrue(greeting.contains("def hello(name, loud=False):"));
        assertTrue(greeting.contains("\"hello \" + name"));
        assertTrue(greeting.contains("class Greeter:"));
    }

    @Test
    void testRenameBackRestoresOriginalBytes() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var app = Files.readString(tempDir.resolve("pkg/app.py"));
        var greeting = Files.readString(tempDir.resolve("pkg/greeting.py"));

        var engine = new RenameEngine(project);
        assertTrue(engine.rename("greet", "salute", false).applied());
        assertTrue(engine.rename("salute", "greet", false).applied());

        assertEquals(app, Files.readString(tempDir.resolve("pkg/app.py")));
        assertEquals(greeting, Files.readString(tempDir.resolve("pkg/greeting.py")));
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var before = Files.readString(tempDir.resolve("pkg/app.py"));

        var result = new RenameEngine(project).rename("greet", "hello", true);
        assertFalse(result.applied());
        assertEquals(5, result.edits().size());
        assertEquals(before, Files.readString(tempDir.resolve("pkg/app.py")));
    }

    @Test
    void testAbsentNameProducesNoEdits() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result = new RenameEngine(project).rename("nowhere_to_be_found", "anything", false);
        assertTrue(result.edits().isEmpty());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testInvalidNamesAreRejected() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var engine = new RenameEngine(project);

        for (var result : List.of(
                engine.rename("greet", "1greet", false),
                engine.rename("greet", "greet", false),
                engine.rename("gr eet", "hello", false))) {
            assertFalse(result.applied());
            assertTrue(result.edits().isEmpty());
            assertEquals(1, result.errors().size());
        }
        assertTrue(Files.readString(tempDir.resolve("pkg/app.py")).contains("greet(\"world\")"));
    }

    @Test
    void testWriteFailureIsReportedPerFile() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        SourceWriter failingForApp = (file, content) -> {
            if (file.toString().equals("pkg/app.py")) {
                throw new IOException("disk full");
            }
            file.write(content);
        };

        var result = new RenameEngine(project, failingForApp).rename("greet", "hello", false);
        assertFalse(result.applied());
        assertEquals(List.of("pkg/app.py: disk full"), result.errors());
        assertEquals(5, result.edits().size());
        assertTrue(Files.readString(tempDir.resolve("pkg/app.py")).contains("greet(\"world\")"));
        assertTrue(Files.readString(tempDir.resolve("pkg/greeting.py")).contains("def hello("));
    }

    @Test
    void testHeuristicLanguagesMatchWholeWords() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result = new RenameEngine(project).rename("greetUser", "welcomeUser", false);

        assertEquals(Set.of("web/ui.js"), result.filesAffected());
        assertEquals(List.of(5, 11), result.edits().stream().map(Edit::line).toList());
        var ui = Files.readString(tempDir.resolve("web/ui.js"));
        assertTrue(ui.contains("function welcomeUser(user) {"));
        assertTrue(ui.contains("return welcomeUser(user);"));
    }

    @Test
    void testRenameParameterAndKeywordArgument() throws IOException {
        var project = TestProjects.create(
                tempDir,
                Map.of("m.py", "def f(loud=False):\n    return loud\n\n\nf(loud=True)\nprint(\"loud\")\n"));
        var result = new RenameEngine(project).rename("loud", "shout", false);

        assertEquals(3, result.edits().size());
        assertEquals(
                "def f(shout=False):\n    return shout\n\n\nf(shout=True)\nprint(\"loud\")\n",
                Files.readString(tempDir.resolve("m.py")));
    }
}
