package ai.refgraph.analyzer;

import ai.refgraph.analyzer.FileSymbolTable.ClassDecl;
import ai.refgraph.analyzer.FileSymbolTable.FunctionDecl;
import ai.refgraph.analyzer.FileSymbolTable.ImportDecl;
import ai.refgraph.analyzer.FileSymbolTable.ImportKind;
import ai.refgraph.analyzer.FileSymbolTable.VariableDecl;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Line-pattern symbol extraction for languages without a bundled grammar. Declarations come from
 * {@link HeuristicSyntax} patterns and their extent from brace balance; occurrence kinds come from the characters
 * around each identifier. Text inside strings and comments is not distinguished from code.
 */
public final class RegexSymbolParser implements ISymbolParser {
    private static final Logger logger = LogManager.getLogger(RegexSymbolParser.class);

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![\\w$])[A-Za-z_$][\\w$]*(?![\\w$])");
    private static final Pattern COMPOUND_ASSIGN = Pattern.compile("^(?:[-+*/%&|^]|\\*\\*|<<|>>>?|\\?\\?|&&|\\|\\|)=");
    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    static final int BLOCK_LINES = 20;
    static final int BLOCK_CHARS = 400;

    private final HeuristicSyntax syntax;

    public RegexSymbolParser(HeuristicSyntax syntax) {
        this.syntax = syntax;
    }

    @Override
    public ParserCapability capability() {
        return ParserCapability.HEURISTIC;
    }

    // ---------------------------------------------------------------------------------------------
    // declarations

    @Override
    public FileSymbolTable extract(ProjectFile file, String source) {
        var table = extract(new SourceText(source));
        logger.trace(
                "Heuristically extracted {} functions, {} classes from {}",
                table.functions().size(),
                table.classes().size(),
                file);
        return table;
    }

    private FileSymbolTable extract(SourceText src) {
        var functions = new ArrayList<FunctionDecl>();
        var classes = new ArrayList<ClassDecl>();
        var variables = new ArrayList<VariableDecl>();
        var imports = new ArrayList<ImportDecl>();

        for (int line = 1; line <= src.lineCount(); line++) {
            var text = src.line(line);
            var cls = matchClass(text);
            if (cls != null) {
                classes.add(new ClassDecl(
                        cls.group("name"),
                        line,
                        blockEnd(src, line),
                        splitList(cls.group("bases")),
                        List.of(),
                        precedingDoc(src, line)));
                continue;
            }
            var fn = matchFunction(text);
            if (fn != null) {
                functions.add(new FunctionDecl(
                        fn.group("name"),
                        line,
                        blockEnd(src, line),
                        parameterNames(fn.group("params")),
                        precedingDoc(src, line),
                        precedingDecorators(src, line),
                        text.matches(".*\\basync\\b.*")));
                continue;
            }
            var lineImports = matchImports(text, line);
            if (!lineImports.isEmpty()) {
                imports.addAll(lineImports);
                continue;
            }
            var variablePattern = syntax.variablePattern();
            var variable = variablePattern == null ? null : variablePattern.matcher(text);
            if (variable != null && variable.find()) {
                var value = variable.group("value");
                variables.add(new VariableDecl(
                        variable.group("name"),
                        line,
                        PythonTreeSitterParser.truncate(
                                value == null ? "" : value.strip(), PythonTreeSitterParser.VALUE_LIMIT)));
            }
        }

        var withMethods = new ArrayList<ClassDecl>(classes.size());
        for (var cls : classes) {
            var methods = functions.stream()
                    .filter(f -> f.start() > cls.start() && f.start() <= cls.end())
                    .filter(f -> innermostClass(classes, f.start()) == cls)
                    .map(FunctionDecl::name)
                    .toList();
            withMethods.add(new ClassDecl(cls.name(), cls.start(), cls.end(), cls.bases(), methods, cls.doc()));
        }
        return new FileSymbolTable(
                functions, withMethods, variables, imports, List.of(), List.of(), ParserCapability.HEURISTIC);
    }

    private @Nullable Matcher matchClass(String line) {
        for (var pattern : syntax.classPatterns()) {
            var m = pattern.matcher(line);
            if (m.find() && !syntax.keywords().contains(m.group("name"))) {
                return m;
            }
        }
        return null;
    }

    private @Nullable Matcher matchFunction(String line) {
        for (var pattern : syntax.functionPatterns()) {
            var m = pattern.matcher(line);
            if (!m.find() || syntax.keywords().contains(m.group("name"))) {
                continue;
            }
            var ret = hasGroup(pattern, "ret") ? m.group("ret") : null;
            if (ret != null && syntax.keywords().contains(ret) && !"void".equals(ret) && !isPrimitive(ret)) {
                continue;
            }
            return m;
        }
        return null;
    }

    private static boolean isPrimitive(String type) {
        return switch (type) {
            case "boolean", "byte", "char", "short", "int", "long", "float", "double" -> true;
            default -> false;
        };
    }

    private static boolean hasGroup(Pattern pattern, String group) {
        return pattern.pattern().contains("(?<" + group + ">");
    }

    private List<ImportDecl> matchImports(String text, int line) {
        for (var pattern : syntax.importPatterns()) {
            var m = pattern.matcher(text);
            if (!m.find()) {
                continue;
            }
            var source = m.group("source");
            var names = m.group("names").strip();
            if (names.isEmpty()) {
                return List.of(new ImportDecl(source, "", line, ImportKind.IMPORT));
            }
            var result = new ArrayList<ImportDecl>();
            for (var part : COMMA.split(names.replace("{", ",").replace("}", ","))) {
                var name = part.startsWith("type ") ? part.substring(5).strip() : part;
                if (name.startsWith("*")) {
                    name = "*";
                } else {
                    int as = name.indexOf(" as ");
                    if (as > 0) {
                        name = name.substring(0, as).strip();
                    }
                    int colon = name.indexOf(':'); // require destructuring rename {a: b}
                    if (colon > 0) {
                        name = name.substring(0, colon).strip();
                    }
                }
                if (!name.isEmpty()) {
                    result.add(new ImportDecl(name, source, line, ImportKind.FROM));
                }
            }
            return result;
        }
        return List.of();
    }

    private static @Nullable ClassDecl innermostClass(List<ClassDecl> classes, int line) {
        return classes.stream()
                .filter(c -> line > c.start() && line <= c.end())
                .min(Comparator.comparingInt(c -> c.end() - c.start()))
                .orElse(null);
    }

    private static List<String> splitList(@Nullable String list) {
        return list == null ? List.of() : COMMA.splitToList(list);
    }

    /** Parameter names from a parameter list, dropping types, defaults and modifiers. */
    static List<String> parameterNames(@Nullable String params) {
        if (params == null || params.isBlank()) {
            return List.of();
        }
        var names = new ArrayList<String>();
        for (var raw : COMMA.split(stripGenerics(params))) {
            var param = raw;
            int eq = param.indexOf('=');
            if (eq >= 0) {
                param = param.substring(0, eq).strip();
            }
            int colon = param.indexOf(':'); // TypeScript annotation
            if (colon >= 0) {
                param = param.substring(0, colon).strip();
            }
            // Java puts the name last: "final List<String> items"
            var tokens = param.split("\\s+");
            var name = tokens[tokens.length - 1].replace("?", "");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static String stripGenerics(String params) {
        var sb = new StringBuilder();
        int depth = 0;
        for (char c : params.toCharArray()) {
            if (c == '<') depth++;
            else if (c == '>') depth = Math.max(0, depth - 1);
            else if (depth == 0) sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Last line of the block that opens on {@code startLine}: where the brace depth returns to zero. A declaration
     * that ends with {@code ;} before any brace opens is a single statement.
     */
    static int blockEnd(SourceText src, int startLine) {
        int depth = 0;
        boolean opened = false;
        for (int line = startLine; line <= src.lineCount(); line++) {
            var text = src.line(line);
            char quote = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                    continue;
                }
                if (c == '"' || c == '\'' || c == '`') {
                    quote = c;
                } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                    break;
                } else if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                    if (opened && depth <= 0) {
                        return line;
                    }
                } else if (c == ';' && !opened && depth == 0) {
                    return line;
                }
            }
        }
        return opened ? src.lineCount() : startLine;
    }

    /** Contiguous {@code @Decorator} lines directly above a declaration, nearest last. */
    private static List<String> precedingDecorators(SourceText src, int line) {
        var result = new ArrayList<String>();
        for (int l = line - 1; l >= 1; l--) {
            var text = src.line(l).strip();
            if (!text.startsWith("@")) {
                break;
            }
            result.add(0, text.substring(1).strip());
        }
        return result;
    }

    /** Block comment or run of line comments directly above the declaration and its decorators. */
    static String precedingDoc(SourceText src, int line) {
        int l = line - 1;
        while (l >= 1 && src.line(l).strip().startsWith("@")) {
            l--;
        }
        if (l < 1) {
            return "";
        }
        var last = src.line(l).strip();
        var lines = new ArrayList<String>();
        if (last.endsWith("*/")) {
            for (; l >= 1; l--) {
                var text = src.line(l).strip();
                lines.add(0, text);
                if (text.startsWith("/*")) {
                    break;
                }
            }
        } else if (last.startsWith("//")) {
            for (; l >= 1 && src.line(l).strip().startsWith("//"); l--) {
                lines.add(0, src.line(l).strip());
            }
        } else {
            return "";
        }
        var sb = new StringBuilder();
        for (var text : lines) {
            var cleaned = text.replaceFirst("^/\\*\\*?", "")
                    .replaceFirst("\\*/$", "")
                    .replaceFirst("^//+", "")
                    .replaceFirst("^\\*", "")
                    .strip();
            if (!cleaned.isEmpty()) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(cleaned);
            }
        }
        return PythonTreeSitterParser.truncate(sb.toString(), PythonTreeSitterParser.DOC_LIMIT);
    }

    // ---------------------------------------------------------------------------------------------
    // occurrences

    @Override
    public List<SymbolOccurrence> occurrences(ProjectFile file, String source) {
        var src = new SourceText(source);
        var table = extract(src);
        Map<Integer, Set<String>> declarations = new HashMap<>();
        table.functions().forEach(f -> declarations.computeIfAbsent(f.start(), k -> new HashSet<>()).add(f.name()));
        table.classes().forEach(c -> declarations.computeIfAbsent(c.start(), k -> new HashSet<>()).add(c.name()));

        var path = file.toString();
        var result = new ArrayList<SymbolOccurrence>();
        for (int line = 1; line <= src.lineCount(); line++) {
            var text = src.line(line);
            var pending = new HashSet<>(declarations.getOrDefault(line, Set.of()));
            var m = IDENTIFIER.matcher(text);
            while (m.find()) {
                var name = m.group();
                if (syntax.keywords().contains(name)) {
                    continue;
                }
                OccurrenceKind kind;
                if (pending.remove(name)) {
                    kind = OccurrenceKind.DEFINITION;
                } else {
                    kind = classify(text, m.start(), m.end());
                }
                result.add(new SymbolOccurrence(path, line, kind, name));
            }
        }
        return result;
    }

    private static OccurrenceKind classify(String line, int start, int end) {
        int before = start - 1;
        while (before >= 0 && Character.isWhitespace(line.charAt(before))) {
            before--;
        }
        int after = end;
        while (after < line.length() && Character.isWhitespace(line.charAt(after))) {
            after++;
        }
        boolean callFollows = after < line.length() && line.charAt(after) == '(';
        if (before >= 0 && line.charAt(before) == '.' && (before == 0 || line.charAt(before - 1) != '.')) {
            return callFollows ? OccurrenceKind.CALL : OccurrenceKind.ATTR;
        }
        if (callFollows) {
            return OccurrenceKind.CALL;
        }
        var rest = line.substring(after);
        if (rest.startsWith("=") && !rest.startsWith("==") && !rest.startsWith("=>")) {
            return OccurrenceKind.STORE;
        }
        if (COMPOUND_ASSIGN.matcher(rest).find()) {
            return OccurrenceKind.STORE;
        }
        return OccurrenceKind.REF;
    }

    // ---------------------------------------------------------------------------------------------
    // rename support

    @Override
    public List<TokenSpan> identifierSpans(String source, String name) {
        var src = new SourceText(source);
        var pattern = Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "(?![\\w$])");
        var spans = new ArrayList<TokenSpan>();
        for (int line = 1; line <= src.lineCount(); line++) {
            var m = pattern.matcher(src.line(line));
            while (m.find()) {
                spans.add(new TokenSpan(line, m.start(), m.end()));
            }
        }
        return spans;
    }

    // ---------------------------------------------------------------------------------------------
    // context blocks

    @Override
    public List<CodeBlock> blocks(ProjectFile file, String source) {
        var src = new SourceText(source);
        var table = extract(src);
        var starts = new HashMap<Integer, CodeBlock>();
        for (var cls : table.classes()) {
            if (innermostClass(table.classes(), cls.start()) == null) {
                starts.putIfAbsent(cls.start(), block(src, cls.name(), cls.start(), cls.doc()));
            }
        }
        for (var fn : table.functions()) {
            if (innermostClass(table.classes(), fn.start()) == null) {
                starts.putIfAbsent(fn.start(), block(src, fn.name(), fn.start(), fn.doc()));
            }
        }
        for (var variable : table.variables()) {
            if (innermostClass(table.classes(), variable.start()) == null) {
                starts.putIfAbsent(variable.start(), block(src, variable.name(), variable.start(), ""));
            }
        }
        return starts.values().stream()
                .sorted(Comparator.comparingInt(CodeBlock::startLine))
                .toList();
    }

    private static CodeBlock block(SourceText src, String name, int start, String doc) {
        int end = Math.min(start + BLOCK_LINES, src.lineCount());
        var text = PythonTreeSitterParser.truncate(src.lines(start, end), BLOCK_CHARS);
        return new CodeBlock(name, CodeBlock.Kind.BLOCK, start, end, text, doc);
    }

    @Override
    public Optional<CodeBlock> findDefinition(String source, String name) {
        var src = new SourceText(source);
        var table = extract(src);
        var candidates = new ArrayList<CodeBlock>();
        table.functions().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .ifPresent(f -> candidates.add(
                        definitionBlock(src, f.name(), CodeBlock.Kind.FUNCTION, f.start(), f.end(), f.doc())));
        table.classes().stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .ifPresent(c -> candidates.add(
                        definitionBlock(src, c.name(), CodeBlock.Kind.CLASS, c.start(), c.end(), c.doc())));
        return candidates.stream().min(Comparator.comparingInt(CodeBlock::startLine));
    }

    private static CodeBlock definitionBlock(
            SourceText src, String name, CodeBlock.Kind kind, int start, int end, String doc) {
        int from = start;
        while (from > 1 && src.line(from - 1).strip().startsWith("@")) {
            from--;
        }
        return new CodeBlock(name, kind, start, end, src.lines(from, end), doc);
    }
}
