package ai.refgraph.graph;

import ai.refgraph.analyzer.FileSymbolTable;
import ai.refgraph.analyzer.Languages;
import ai.refgraph.analyzer.SymbolOccurrence;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/** Read-only lookups over a {@link CrossRefGraph}. */
public final class GraphQueries {
    static final int SUMMARY_CLASSES = 4;
    static final int SUMMARY_FUNCTIONS = 8;
    static final int SUMMARY_VARIABLES = 6;

    private GraphQueries() {}

    /** All occurrences of the exact, case-sensitive name. */
    public static List<SymbolOccurrence> query(CrossRefGraph graph, String name) {
        return graph.occurrencesOf(name);
    }

    public static List<SymbolOccurrence> definitions(CrossRefGraph graph, String name) {
        return query(graph, name).stream()
                .filter(SymbolOccurrence::isDefinition)
                .toList();
    }

    /** Every occurrence that is not a definition. */
    public static List<SymbolOccurrence> usages(CrossRefGraph graph, String name) {
        return query(graph, name).stream()
                .filter(o -> !o.isDefinition())
                .toList();
    }

    /** Indexed names starting with {@code prefix}, ignoring case, in sorted order. */
    public static List<String> prefixSearch(CrossRefGraph graph, String prefix) {
        var p = prefix.toLowerCase(Locale.ROOT);
        return graph.crossRefs().keySet().stream()
                .filter(name -> name.toLowerCase(Locale.ROOT).startsWith(p))
                .toList();
    }

    /** The declaration table of a file, or an empty table when the file is not indexed. */
    public static FileSymbolTable symbolsInFile(CrossRefGraph graph, String path) {
        var table = graph.fileTable().get(path);
        if (table != null) {
            return table;
        }
        int dot = path.lastIndexOf('.');
        var extension = dot < 0 ? "" : path.substring(dot + 1);
        return FileSymbolTable.empty(Languages.fromExtension(extension).capability());
    }

    /** One line such as {@code classes: A, B | functions: f, g | vars: X}, or {@code (empty)}. */
    public static String fileSummary(CrossRefGraph graph, String path) {
        var table = symbolsInFile(graph, path);
        var parts = new ArrayList<String>();
        addPart(parts, "classes", table.classes().stream().map(FileSymbolTable.ClassDecl::name), SUMMARY_CLASSES);
        addPart(
                parts,
                "functions",
                table.functions().stream().map(FileSymbolTable.FunctionDecl::name),
                SUMMARY_FUNCTIONS);
        addPart(parts, "vars", table.variables().stream().map(FileSymbolTable.VariableDecl::name), SUMMARY_VARIABLES);
        return parts.isEmpty() ? "(empty)" : String.join(" | ", parts);
    }

    private static void addPart(List<String> parts, String label, Stream<String> names, int limit) {
        var shown = names.limit(limit).toList();
        if (!shown.isEmpty()) {
            parts.add(label + ": " + String.join(", ", shown));
        }
    }
}
