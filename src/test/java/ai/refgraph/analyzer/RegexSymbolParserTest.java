package ai.refgraph.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegexSymbolParserTest {
    private final RegexSymbolParser jsParser = new RegexSymbolParser(HeuristicSyntax.JAVASCRIPT);
    private final RegexSymbolParser javaParser = new RegexSymbolParser(HeuristicSyntax.JAVA);

    @TempDir
    Path root;

    private static final String UI_JS =
            """
            import { render, h as hh } from "./dom";
            import "./side.css";

            const TITLE = "Welcome";

            // Greets a user.
            function greetUser(user) {
              return render(TITLE + user.name);
            }

            export class Banner extends Base {
              show(user) {
                this.count += 1;
                return greetUser(user);
              }
            }
            """;

    private static final String GREETER_JAVA =
            """
            package demo;

            import java.util.List;
            import static java.util.Objects.requireNonNull;

            /** Greets people. */
            @Service
            public class Greeter extends Base {
                private static final int MAX = 3;

                @Override
                public String greet(final String name, int count) {
                    return requireNonNull(name);
                }
            }
            """;

    private ProjectFile file(String relPath) {
        return new ProjectFile(root.toAbsolutePath().normalize(), relPath);
    }

    @Test
    void testJavaScriptDeclarations() {
        var table = jsParser.extract(file("web/ui.js"), UI_JS);
        assertEquals(ParserCapability.HEURISTIC, table.confidence());

        assertEquals(2, table.functions().size());
        var greetUser = table.functions().get(0);
        assertEquals("greetUser", greetUser.name());
        assertEquals(7, greetUser.start());
        assertEquals(9, greetUser.end());
        assertEquals(List.of("user"), greetUser.params());
        assertEquals("Greets a user.", greetUser.doc());
        assertFalse(greetUser.isAsync());

        var show = table.functions().get(1);
        assertEquals("show", show.name());
        assertEquals(12, show.start());
        assertEquals(15, show.end());

        assertEquals(
                List.of(new FileSymbolTable.ClassDecl("Banner", 11, 16, List.of("Base"), List.of("show"), "")),
                table.classes());
        assertEquals(List.of(new FileSymbolTable.VariableDecl("TITLE", 4, "\"Welcome\"")), table.variables());
    }

    @Test
    void testJavaScriptImports() {
        var imports = jsParser.extract(file("web/ui.js"), UI_JS).imports();
        assertEquals(
                List.of(
                        new FileSymbolTable.ImportDecl("render", "./dom", 1, FileSymbolTable.ImportKind.FROM),
                        new FileSymbolTable.ImportDecl("h", "./dom", 1, FileSymbolTable.ImportKind.FROM),
                        new FileSymbolTable.ImportDecl("./side.css", "", 2, FileSymbolTable.ImportKind.IMPORT)),
                imports);
    }

    @Test
    void testStatementsAreNotDeclarations() {
        // "return foo(x);" looks like a method declaration with a return type
        var table = javaParser.extract(file("demo/Greeter.java"), GREETER_JAVA);
        assertEquals(
                List.of("greet"),
                table.functions().stream().map(FileSymbolTable.FunctionDecl::name).toList());
    }

    @Test
    void testJavaDeclarations() {
        var table = javaParser.extract(file("demo/Greeter.java"), GREETER_JAVA);

        var greet = table.functions().get(0);
        assertEquals(12, greet.start());
        assertEquals(14, greet.end());
        assertEquals(List.of("name", "count"), greet.params());
        assertEquals(List.of("Override"), greet.decorators());

        var greeter = table.classes().get(0);
        assertEquals("Greeter", greeter.name());
        assertEquals(8, greeter.start());
        assertEquals(15, greeter.end());
        assertEquals(List.of("Base"), greeter.bases());
        assertEquals(List.of("greet"), greeter.methods());
        assertEquals("Greets people.", greeter.doc());

        assertEquals(
                List.of(
                        new FileSymbolTable.ImportDecl("List", "java.util", 3, FileSymbolTable.ImportKind.FROM),
                        new FileSymbolTable.ImportDecl(
                                "requireNonNull", "java.util.Objects", 4, FileSymbolTable.ImportKind.FROM)),
                table.imports());
        assertEquals(List.of(new FileSymbolTable.VariableDecl("MAX", 9, "3")), table.variables());
    }

    @Test
    void testOccurrenceKinds() {
        var ui = file("web/ui.js");
        var occurrences = jsParser.occurrences(ui, UI_JS);
        var path = ui.toString();

        assertTrue(occurrences.contains(new SymbolOccurrence(path, 7, OccurrenceKind.DEFINITION, "greetUser")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 14, OccurrenceKind.CALL, "greetUser")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 11, OccurrenceKind.DEFINITION, "Banner")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 12, OccurrenceKind.DEFINITION, "show")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 4, OccurrenceKind.STORE, "TITLE")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 8, OccurrenceKind.REF, "TITLE")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 8, OccurrenceKind.CALL, "render")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 8, OccurrenceKind.ATTR, "name")));
        assertTrue(occurrences.contains(new SymbolOccurrence(path, 13, OccurrenceKind.ATTR, "count")));

        assertTrue(occurrences.stream().noneMatch(o -> o.name().equals("return") || o.name().equals("this")));
    }

    @Test
    void testIdentifierSpansMatchWholeWords() {
        var source = "greetUser(x);\nconst greetUsers = greetUser;\n";
        assertEquals(
                List.of(new TokenSpan(1, 0, 9), new TokenSpan(2, 19, 28)),
                jsParser.identifierSpans(source, "greetUser"));
    }

    @Test
    void testBlocksAreTopLevelOnly() {
        var blocks = jsParser.blocks(file("web/ui.js"), UI_JS);
        assertEquals(
                List.of("TITLE", "greetUser", "Banner"),
                blocks.stream().map(CodeBlock::name).toList());
        assertTrue(blocks.stream().allMatch(b -> b.kind() == CodeBlock.Kind.BLOCK));
        assertEquals(4, blocks.get(0).startLine());
        assertTrue(blocks.get(1).text().startsWith("function greetUser(user) {"));
    }

    @Test
    void testFindDefinition() {
        var fn = jsParser.findDefinition(UI_JS, "greetUser").orElseThrow();
        assertEquals(CodeBlock.Kind.FUNCTION, fn.kind());
        assertEquals("function greetUser(user) {\n  return render(TITLE + user.name);\n}\n", fn.text());

        var cls = jsParser.findDefinition(UI_JS, "Banner").orElseThrow();
        assertEquals(CodeBlock.Kind.CLASS, cls.kind());
        assertEquals(11, cls.startLine());
        assertEquals(16, cls.endLine());

        var method = javaParser.findDefinition(GREETER_JAVA, "greet").orElseThrow();
        assertTrue(method.text().startsWith("    @Override\n"), method.text());

        assertTrue(jsParser.findDefinition(UI_JS, "TITLE").isEmpty());
    }

    @Test
    void testParameterNames() {
        assertEquals(List.of("a", "b"), RegexSymbolParser.parameterNames("a: number, b?: string = 'x'"));
        assertEquals(List.of("m", "xs"), RegexSymbolParser.parameterNames("Map<String, List<Integer>> m, int[] xs"));
        assertEquals(List.of(), RegexSymbolParser.parameterNames("  "));
    }

    @Test
    void testBlockEnd() {
        var src = new SourceText("const s = \"{\";\nfunction f() {\n  if (x) { y(); }\n}\nfunction open() {\n");
        assertEquals(1, RegexSymbolParser.blockEnd(src, 1));
        assertEquals(4, RegexSymbolParser.blockEnd(src, 2));
        assertEquals(5, RegexSymbolParser.blockEnd(src, 5));
    }
}
