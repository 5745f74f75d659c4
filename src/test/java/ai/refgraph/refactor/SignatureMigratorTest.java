package ai.refgraph.refactor;

import static org.junit.jupiter.api.Assertions.*;

import ai.refgraph.analyzer.CallSite;
import ai.refgraph.testutil.TestProjects;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignatureMigratorTest {
    @TempDir
    Path tempDir;

    @Test
    void testMissingArgumentsGetDefaults() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result =
                new SignatureMigrator(project).migrate("greet", ParamSpec.parseList("name, loud=False"), false);

        assertTrue(result.applied());
        assertEquals(List.of("name", "loud"), result.oldParams());
        assertEquals(List.of("name", "loud=False"), result.newParams());
        assertTrue(result.warnings().isEmpty());
        assertEquals(
                List.of("pkg/app.py:6", "pkg/greeting.py:21"),
                result.edits().stream().map(e -> e.file() + ":" + e.line()).toList());

        var app = Files.readString(tempDir.resolve("pkg/app.py"));
        assertTrue(app.contains("print(greet(\"world\", False))"), app);
        // already complete: the keyword argument covers loud
        assertTrue(app.contains("print(greet(\"x\", loud=True))"), app);
        var greeting = Files.readString(tempDir.resolve("pkg/greeting.py"));
        assertTrue(greeting.contains("[greet(self.prefix + n, False) for n in"), greeting);
    }

    @Test
    void testNewLeadingParameter() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result = new SignatureMigrator(project)
                .migrate("greet", ParamSpec.parseList("prefix=\"\", name, loud=False"), false);

        assertTrue(result.applied());
        var app = Files.readString(tempDir.resolve("pkg/app.py"));
        assertTrue(app.contains("print(greet(\"\", \"world\", False))"), app);
        assertTrue(app.contains("print(greet(\"\", \"x\", loud=True))"), app);
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var before = Files.readString(tempDir.resolve("pkg/app.py"));

        var result =
                new SignatureMigrator(project).migrate("greet", ParamSpec.parseList("name, loud=False"), true);
        assertFalse(result.applied());
        assertEquals(2, result.edits().size());
        var edit = result.edits().get(0);
        assertEquals("(\"world\")", edit.oldText());
        assertEquals("(\"world\", False)", edit.newText());
        assertEquals(before, Files.readString(tempDir.resolve("pkg/app.py")));
    }

    @Test
    void testWriteFailureIsReportedPerFile() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        SourceWriter readOnlyApp = (file, content) -> {
            if (file.toString().equals("pkg/app.py")) {
                throw new IOException("read-only file system");
            }
            file.write(content);
        };

        var result = new SignatureMigrator(project, readOnlyApp)
                .migrate("greet", ParamSpec.parseList("name, loud=False"), false);
        assertFalse(result.applied());
        assertEquals(List.of("pkg/app.py: read-only file system"), result.errors());
        assertEquals(2, result.edits().size());

        // later files are still rewritten
        assertTrue(Files.readString(tempDir.resolve("pkg/app.py")).contains("print(greet(\"world\"))"));
        var greeting = Files.readString(tempDir.resolve("pkg/greeting.py"));
        assertTrue(greeting.contains("[greet(self.prefix + n, False) for n in"), greeting);
    }

    @Test
    void testUnknownFunction() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var result = new SignatureMigrator(project).migrate("nope", ParamSpec.parseList("a"), false);
        assertFalse(result.applied());
        assertTrue(result.edits().isEmpty());
        assertEquals(List.of("Could not find definition of 'nope'"), result.errors());
    }

    @Test
    void testUnsafeCallsAreSkippedWithWarnings() throws IOException {
        var source =
                """
                def greet(name, loud=False):
                    pass

                greet(name="a")
                greet(*args)
                greet(greet("a"))
                """;
        var project = TestProjects.create(tempDir, Map.of("m.py", source));
        var result =
                new SignatureMigrator(project).migrate("greet", ParamSpec.parseList("name, loud=False"), false);

        assertEquals(
                List.of(
                        "m.py:4: a parameter is passed both by keyword and by position, not rewritten",
                        "m.py:5: argument unpacking, not rewritten",
                        "m.py:6: nested inside another rewritten call, not rewritten"),
                result.warnings());
        assertEquals(1, result.edits().size());
        var text = Files.readString(tempDir.resolve("m.py"));
        assertTrue(text.contains("greet(greet(\"a\"), False)"), text);
        assertTrue(text.contains("greet(name=\"a\")"));
        assertTrue(text.contains("greet(*args)"));
    }

    @Test
    void testZeroParameterFunction() throws IOException {
        var project = TestProjects.create(tempDir, Map.of("m.py", "def ping():\n    pass\n\n\nping()\n"));
        var result = new SignatureMigrator(project).migrate("ping", ParamSpec.parseList("verbose=False"), false);

        assertTrue(result.applied());
        assertEquals(List.of(), result.oldParams());
        assertEquals("def ping():\n    pass\n\n\nping(False)\n", Files.readString(tempDir.resolve("m.py")));
    }

    @Test
    void testFirstDefinitionInPathOrderWins() throws IOException {
        var project = TestProjects.create(
                tempDir,
                Map.of(
                        "a.py", "def run(x, y):\n    pass\n",
                        "b.py", "def run(y):\n    pass\n\n\nrun(1, 2)\n"));
        var result = new SignatureMigrator(project).migrate("run", ParamSpec.parseList("y, x"), false);

        assertEquals(List.of("x", "y"), result.oldParams());
        assertTrue(Files.readString(tempDir.resolve("b.py")).contains("run(2, 1)"));
    }

    @Test
    void testHeuristicFilesAreNotMigrated() throws IOException {
        var project = TestProjects.copyFixture("testcode-py", tempDir);
        var before = Files.readString(tempDir.resolve("web/ui.js"));
        var result = new SignatureMigrator(project).migrate("greetUser", ParamSpec.parseList("user, extra"), false);

        assertEquals(List.of("Could not find definition of 'greetUser'"), result.errors());
        assertEquals(before, Files.readString(tempDir.resolve("web/ui.js")));
    }

    @Test
    void testRewriteReordersPositionalArguments() {
        var call = new CallSite(1, 0, 6, "(a, b)", List.of("a", "b"), List.of(), false);
        assertEquals(
                "(b, a)",
                SignatureMigrator.rewrite(call, List.of("x", "y"), ParamSpec.parseList("y, x"))
                        .orElseThrow());
        assertEquals(
                "(a, None)",
                SignatureMigrator.rewrite(call, List.of("x", "y"), ParamSpec.parseList("x, z"))
                        .orElseThrow());
    }

    @Test
    void testRewriteKeepsKeywordArguments() {
        var sep = new CallSite.KeywordArgument("sep", "sep=\"-\"");
        var call = new CallSite(1, 0, 12, "(a, sep=\"-\")", List.of("a"), List.of(sep), false);
        assertEquals(
                "(a, 0, sep=\"-\")",
                SignatureMigrator.rewrite(call, List.of("x"), ParamSpec.parseList("x, n=0, sep=\"\""))
                        .orElseThrow());
    }
}
