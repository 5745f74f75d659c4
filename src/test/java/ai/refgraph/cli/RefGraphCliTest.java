package ai.refgraph.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.refgraph.testutil.TestProjects;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RefGraphCliTest {
    @TempDir
    Path tempDir;

    private Path app;
    private String appBefore;

    private record Run(int exitCode, String out, String err) {}

    @BeforeEach
    void setUp() throws IOException {
        TestProjects.copyFixture("testcode-py", tempDir);
        app = tempDir.resolve("pkg/app.py");
        appBefore = Files.readString(app);
    }

    private Run runWithInput(String stdin, String... args) {
        var cli = new RefGraphCli(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), tempDir);
        var cmd = RefGraphCli.commandLine(cli);
        var out = new StringWriter();
        var err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int exitCode = cmd.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    /** Runs against the fixture root with nothing on stdin. */
    private Run run(String... args) {
        var all = new ArrayList<>(List.of("--root", tempDir.toString()));
        all.addAll(List.of(args));
        return runWithInput("", all.toArray(new String[0]));
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        var result = run();
        assertEquals(RefGraphCli.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().contains("Usage: refgraph"), result.err());
    }

    @Test
    void testMissingRootIsAUsageError() {
        var result = runWithInput("", "--root", tempDir.resolve("missing").toString(), "defs", "greet");
        assertEquals(RefGraphCli.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().startsWith("Error: Project root is not a directory"), result.err());
    }

    @Test
    void testIndex() {
        var result = run("index", "--full");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        assertTrue(result.out().startsWith("Indexed 4 file(s), "), result.out());
        assertTrue(Files.exists(tempDir.resolve(".refgraph/symbol_graph.json")));
    }

    @Test
    void testIndexWithIgnore() throws IOException {
        var result = run("index", "--ignore", "web");
        assertTrue(result.out().startsWith("Indexed 3 file(s), "), result.out());
        assertTrue(Files.readString(tempDir.resolve(".refgraph/project.properties")).contains("ignoreDirs=web"));
    }

    @Test
    void testUsages() {
        var result = run("usages", "greet");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        var out = result.out();
        assertTrue(out.contains("  Usages of 'greet' (4 total)"), out);
        assertTrue(out.contains("DEFINITIONS (1):\n  pkg/greeting.py:6  def greet(name, loud=False):"), out);
        assertTrue(out.contains("CALL SITES (3):\n  pkg/app.py:6  print(greet(\"world\"))"), out);
        assertFalse(out.contains("OTHER REFERENCES"), out);

        var greeter = run("usages", "greeter").out();
        assertTrue(greeter.contains("OTHER REFERENCES (2):"), greeter);

        assertEquals("No usages found for 'zebra'\n", run("usages", "zebra").out());
    }

    @Test
    void testDefsSearchAndSummary() {
        assertEquals("pkg/greeting.py:6\n", run("defs", "greet").out());
        assertEquals("No definitions found for 'zebra'\n", run("defs", "zebra").out());
        assertEquals("Greeter\ngreet\ngreetUser\ngreet_all\ngreeter\n", run("search", "GRE").out());
        assertEquals("pkg/app.py: functions: main\n", run("summary", "pkg/app.py").out());
    }

    @Test
    void testRenameDryRunByDefault() throws IOException {
        var result = run("rename", "greet", "hello");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        var out = result.out();
        assertTrue(out.contains("  Rename: 'greet' -> 'hello'"), out);
        assertTrue(out.contains("  Mode:   DRY RUN (pass --apply to write)"), out);
        assertTrue(out.contains("5 edit(s) across 2 file(s):"), out);
        assertTrue(out.contains("  pkg/app.py  (3 sites)"), out);
        assertTrue(out.contains("    L6: print(greet(\"world\"))"), out);
        assertEquals(appBefore, Files.readString(app));
    }

    @Test
    void testRenameApplyRefreshesIndexedGraph() throws IOException {
        run("index");
        var result = run("rename", "greet", "hello", "--apply", "--yes");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode(), result.err());
        assertTrue(result.out().contains("  Mode:   APPLIED"), result.out());
        assertFalse(result.out().contains("[y/N]"));
        assertTrue(Files.readString(app).contains("print(hello(\"world\"))"));

        assertEquals("pkg/greeting.py:6\n", run("defs", "hello").out());
        assertEquals("No definitions found for 'greet'\n", run("defs", "greet").out());
    }

    @Test
    void testRenamePromptDeclined() throws IOException {
        var result = runWithInput("n\n", "--root", tempDir.toString(), "rename", "greet", "hello", "--apply");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        var out = result.out();
        assertTrue(out.contains("  Mode:   PREVIEW"), out);
        assertTrue(out.contains("Rename 'greet' to 'hello' in 2 file(s)? [y/N] "), out);
        assertTrue(out.contains("No changes written."), out);
        assertEquals(appBefore, Files.readString(app));
    }

    @Test
    void testRenamePromptAccepted() throws IOException {
        var result = runWithInput("yes\n", "--root", tempDir.toString(), "rename", "greet", "hello", "--apply");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        assertTrue(result.out().contains("  Mode:   APPLIED"), result.out());
        assertTrue(Files.readString(app).contains("print(hello(\"world\"))"));
    }

    @Test
    void testRenameInvalidNameReportsErrors() {
        var result = run("rename", "greet", "1bad", "--apply", "--yes");
        assertEquals(RefGraphCli.EXIT_ERRORS, result.exitCode());
        assertTrue(result.out().contains("ERRORS:"), result.out());
    }

    @Test
    void testSignatureDryRun() throws IOException {
        var result = run("signature", "greet", "name", "loud=False");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode(), result.err());
        var out = result.out();
        assertTrue(out.contains("  Signature migration: greet(name, loud=False)"), out);
        assertTrue(out.contains("2 call site(s) found:"), out);
        assertTrue(out.contains("  pkg/app.py:6\n    before: (\"world\")\n    after:  (\"world\", False)"), out);
        assertEquals(appBefore, Files.readString(app));
    }

    @Test
    void testSignatureApply() throws IOException {
        var result = run("signature", "greet", "name, loud=False", "--apply", "--yes");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode(), result.err());
        assertTrue(result.out().contains("  Mode: APPLIED"), result.out());
        assertTrue(Files.readString(app).contains("print(greet(\"world\", False))"));
    }

    @Test
    void testSignatureErrors() {
        var unknown = run("signature", "nope", "a");
        assertEquals(RefGraphCli.EXIT_ERRORS, unknown.exitCode());
        assertTrue(unknown.out().contains("  ERROR: Could not find definition of 'nope'"), unknown.out());

        var badSpec = run("signature", "greet", "1x");
        assertEquals(RefGraphCli.EXIT_USAGE, badSpec.exitCode());
        assertTrue(badSpec.err().contains("Error: Invalid parameter name '1x'"), badSpec.err());

        assertEquals(RefGraphCli.EXIT_USAGE, run("signature", "greet").exitCode());
    }

    @Test
    void testContext() {
        var result = run("context", "greet", "--max-chars", "100000");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        assertTrue(
                result.out().startsWith("[RELEVANT CODE CHUNKS]\n\n# pkg/greeting.py::greet (L6-11)\n"), result.out());
        assertTrue(result.out().contains("[/RELEVANT CODE CHUNKS]"));

        assertEquals("No relevant code found for 'zebra stripes'\n", run("context", "zebra", "stripes").out());
        assertEquals(RefGraphCli.EXIT_USAGE, run("context", "greet", "--max-chars", "0").exitCode());
    }

    @Test
    void testSlice() {
        var result = run("slice", "greet", "--context", "0");
        assertEquals(RefGraphCli.EXIT_OK, result.exitCode());
        assertTrue(result.out().startsWith("# pkg/greeting.py (L6-11, definition L6-11)\ndef greet("), result.out());

        var missing = run("slice", "missing");
        assertEquals(RefGraphCli.EXIT_ERRORS, missing.exitCode());
        assertEquals("Definition of 'missing' not found\n", missing.err());

        assertEquals(RefGraphCli.EXIT_USAGE, run("slice", "greet", "--context=-1").exitCode());
    }

    @Test
    void testPatch() throws IOException {
        var search = tempDir.resolve("patches/search.txt");
        var replace = tempDir.resolve("patches/replace.txt");
        TestProjects.write(tempDir, "patches/search.txt", "greet(\"world\")");
        TestProjects.write(tempDir, "patches/replace.txt", "greet(\"everyone\")");

        var patched = patch(search, replace);
        assertEquals(RefGraphCli.EXIT_OK, patched.exitCode(), patched.err());
        assertEquals("Patched pkg/app.py\n", patched.out());
        assertTrue(Files.readString(app).contains("print(greet(\"everyone\"))"));

        var again = patch(search, replace);
        assertEquals(RefGraphCli.EXIT_ERRORS, again.exitCode());
        assertEquals("Search text not found in pkg/app.py\n", again.err());

        TestProjects.write(tempDir, "patches/search.txt", "");
        TestProjects.write(tempDir, "patches/replace.txt", "EXTRA = 1");
        var appended = patch(search, replace);
        assertEquals("Appended to pkg/app.py\n", appended.out());
        assertTrue(Files.readString(app).endsWith("\n\nEXTRA = 1\n"));

        assertEquals(RefGraphCli.EXIT_USAGE, run("patch", "pkg/app.py").exitCode());
    }

    private Run patch(Path search, Path replace) {
        return run("patch", "pkg/app.py", "--search-file", search.toString(), "--replace-file", replace.toString());
    }

    @Test
    void testDiscoverRoot() throws IOException {
        var nested = tempDir.resolve("a/b/c");
        Files.createDirectories(nested);
        Files.createDirectories(tempDir.resolve("a/.refgraph"));
        assertEquals(tempDir.resolve("a").toAbsolutePath().normalize(), RefGraphCli.discoverRoot(nested));

        Files.createDirectories(tempDir.resolve("a/b/.git"));
        assertEquals(tempDir.resolve("a/b").toAbsolutePath().normalize(), RefGraphCli.discoverRoot(nested));
    }
}
