package ai.refgraph.analyzer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Line patterns describing the declarations of a brace-delimited language closely enough for a heuristic parser.
 *
 * <p>Group contract: function patterns capture {@code name} and {@code params}; class patterns capture {@code name}
 * and {@code bases}; the variable pattern captures {@code name} and {@code value}; import patterns capture
 * {@code names} and {@code source}. A function pattern may also capture {@code ret}, which is rejected when it is a
 * keyword ({@code return foo(x);} is a statement, not a declaration).
 */
public record HeuristicSyntax(
        List<Pattern> functionPatterns,
        List<Pattern> classPatterns,
        @Nullable Pattern variablePattern,
        List<Pattern> importPatterns,
        Set<String> keywords) {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Set<String> JS_KEYWORDS = Set.of(
            "async", "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "export", "extends", "false", "finally", "for", "from", "function", "if", "import", "in",
            "instanceof", "let", "new", "null", "of", "return", "static", "super", "switch", "this", "throw", "true",
            "try", "typeof", "undefined", "var", "void", "while", "with", "yield");

    private static final Set<String> TS_ONLY_KEYWORDS = Set.of(
            "abstract", "as", "declare", "enum", "implements", "interface", "keyof", "namespace", "private",
            "protected", "public", "readonly", "type");

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const", "continue",
            "default", "do", "double", "else", "enum", "extends", "false", "final", "finally", "float", "for", "goto",
            "if", "implements", "import", "instanceof", "int", "interface", "long", "native", "new", "null",
            "package", "private", "protected", "public", "record", "return", "short", "static", "strictfp", "super",
            "switch", "synchronized", "this", "throw", "throws", "transient", "true", "try", "var", "void",
            "volatile", "while", "yield");

    private static final List<Pattern> JS_FUNCTIONS = List.of(
            Pattern.compile("^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>" + IDENT
                    + ")\\s*(?:<[^>]*>)?\\s*\\((?<params>[^)]*)"),
            Pattern.compile("^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>" + IDENT
                    + ")\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:function\\b\\s*\\*?\\s*[\\w$]*\\s*)?\\((?<params>[^)]*)\\)"
                    + "\\s*(?::\\s*[^=]+?)?\\s*(?:=>|\\{)"),
            Pattern.compile("^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>" + IDENT
                    + ")\\s*=\\s*(?:async\\s+)?(?<params>" + IDENT + ")\\s*=>"),
            Pattern.compile("^\\s+(?:(?:public|private|protected|static|readonly|abstract|override|async|get|set)\\s+)*"
                    + "\\*?(?<name>" + IDENT + ")\\s*(?:<[^>]*>)?\\s*\\((?<params>[^)]*)\\)\\s*(?::\\s*[^{;]+)?\\s*\\{"));

    private static final List<Pattern> JS_CLASSES = List.of(Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?(?:class|interface)\\s+(?<name>"
                    + IDENT + ")(?:\\s*<[^>{]*>)?(?:\\s+extends\\s+(?<bases>[\\w$.]+(?:\\s*,\\s*[\\w$.]+)*))?"));

    private static final Pattern JS_VARIABLE = Pattern.compile(
            "^(?:export\\s+)?(?:const|let|var)\\s+(?<name>" + IDENT + ")\\s*(?::\\s*[^=]+?)?\\s*=\\s*(?<value>.*?);?\\s*$");

    private static final List<Pattern> JS_IMPORTS = List.of(
            Pattern.compile("^\\s*import\\s+(?:type\\s+)?(?<names>.+?)\\s+from\\s+['\"](?<source>[^'\"]+)['\"]"),
            Pattern.compile("^\\s*import\\s+(?<names>)['\"](?<source>[^'\"]+)['\"]"),
            Pattern.compile("^\\s*(?:const|let|var)\\s+(?<names>.+?)\\s*=\\s*require\\(\\s*['\"](?<source>[^'\"]+)['\"]\\s*\\)"));

    private static final String JAVA_ANNOTATIONS = "(?:@[\\w$.]+(?:\\([^)]*\\))?\\s+)*";

    public static final HeuristicSyntax JAVASCRIPT =
            new HeuristicSyntax(JS_FUNCTIONS, JS_CLASSES, JS_VARIABLE, JS_IMPORTS, JS_KEYWORDS);

    public static final HeuristicSyntax TYPESCRIPT = new HeuristicSyntax(
            JS_FUNCTIONS,
            List.of(
                    JS_CLASSES.get(0),
                    Pattern.compile("^\\s*(?:export\\s+)?(?:declare\\s+)?(?:const\\s+)?enum\\s+(?<name>" + IDENT
                            + ")(?<bases>)")),
            JS_VARIABLE,
            JS_IMPORTS,
            union(JS_KEYWORDS, TS_ONLY_KEYWORDS));

    public static final HeuristicSyntax JAVA = new HeuristicSyntax(
            List.of(
                    Pattern.compile("^\\s*" + JAVA_ANNOTATIONS
                            + "(?:(?:public|protected|private|static|final|abstract|synchronized|native|default|strictfp)\\s+)*"
                            + "(?:<[^>]+>\\s+)?(?<ret>[\\w$.]+(?:<[^()]*?>)?(?:\\[\\])*)\\s+(?<name>" + IDENT
                            + ")\\s*\\((?<params>[^)]*)\\)?\\s*(?:throws\\s+[\\w$.,\\s]+)?\\s*(?:\\{.*|;)?\\s*$"),
                    Pattern.compile("^\\s*" + JAVA_ANNOTATIONS + "(?:public|protected|private)\\s+(?<name>[A-Z][\\w$]*)"
                            + "\\s*\\((?<params>[^)]*)\\)?\\s*(?:throws\\s+[\\w$.,\\s]+)?\\s*\\{?\\s*$")),
            List.of(Pattern.compile("^\\s*" + JAVA_ANNOTATIONS
                    + "(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*"
                    + "(?:class|interface|enum|record|@interface)\\s+(?<name>" + IDENT + ")(?:\\s*<[^{]*?>)?"
                    + "(?:\\s*\\([^)]*\\))?(?:\\s+extends\\s+(?<bases>[\\w$.]+(?:\\s*,\\s*[\\w$.]+)*))?")),
            Pattern.compile("^\\s*(?:(?:public|protected|private|static|final|transient|volatile)\\s+)+"
                    + "[\\w$.]+(?:<[^=;]*?>)?(?:\\[\\])*\\s+(?<name>" + IDENT + ")\\s*(?:=\\s*(?<value>[^;]*))?;"),
            List.of(Pattern.compile(
                    "^\\s*import\\s+(?:static\\s+)?(?<source>[\\w$.]+)\\.(?<names>[\\w$]+|\\*)\\s*;")),
            JAVA_KEYWORDS);

    /** Files of unknown languages: identifiers only, no declarations. */
    public static final HeuristicSyntax PLAIN = new HeuristicSyntax(List.of(), List.of(), null, List.of(), Set.of());

    private static Set<String> union(Set<String> a, Set<String> b) {
        var all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
