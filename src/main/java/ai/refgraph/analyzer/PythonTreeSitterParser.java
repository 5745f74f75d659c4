package ai.refgraph.analyzer;

import static ai.refgraph.analyzer.ASTTraversalUtils.endLine;
import static ai.refgraph.analyzer.ASTTraversalUtils.field;
import static ai.refgraph.analyzer.ASTTraversalUtils.isField;
import static ai.refgraph.analyzer.ASTTraversalUtils.namedChildren;
import static ai.refgraph.analyzer.ASTTraversalUtils.parent;
import static ai.refgraph.analyzer.ASTTraversalUtils.sameNode;
import static ai.refgraph.analyzer.ASTTraversalUtils.startLine;
import static ai.refgraph.analyzer.ASTTraversalUtils.text;

import ai.refgraph.analyzer.FileSymbolTable.AnnotationDecl;
import ai.refgraph.analyzer.FileSymbolTable.AssignmentDecl;
import ai.refgraph.analyzer.FileSymbolTable.ClassDecl;
import ai.refgraph.analyzer.FileSymbolTable.FunctionDecl;
import ai.refgraph.analyzer.FileSymbolTable.ImportDecl;
import ai.refgraph.analyzer.FileSymbolTable.ImportKind;
import ai.refgraph.analyzer.FileSymbolTable.VariableDecl;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Python symbol extraction on the tree-sitter Python grammar. Strings and comments are their own node kinds, so
 * nothing inside them is ever reported as a name.
 */
public final class PythonTreeSitterParser implements ISymbolParser {
    private static final Logger logger = LogManager.getLogger(PythonTreeSitterParser.class);

    static final int DOC_LIMIT = 200;
    static final int VALUE_LIMIT = 80;

    // Python node types
    private static final String FUNCTION_DEFINITION = "function_definition";
    private static final String CLASS_DEFINITION = "class_definition";
    private static final String DECORATED_DEFINITION = "decorated_definition";
    private static final String DECORATOR = "decorator";
    private static final String EXPRESSION_STATEMENT = "expression_statement";
    private static final String ASSIGNMENT = "assignment";
    private static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    private static final String IDENTIFIER = "identifier";
    private static final String ATTRIBUTE = "attribute";
    private static final String CALL = "call";
    private static final String ARGUMENT_LIST = "argument_list";
    private static final String KEYWORD_ARGUMENT = "keyword_argument";
    private static final String STRING = "string";
    private static final String COMMENT = "comment";

    /** Containers a store target can be nested in, e.g. {@code a, (b, *c) = ...}. */
    private static final Set<String> TARGET_CONTAINERS = Set.of(
            "pattern_list",
            "tuple_pattern",
            "list_pattern",
            "list_splat_pattern",
            "tuple",
            "list",
            "expression_list",
            "parenthesized_expression",
            "list_splat");

    /** Parents whose identifier children are import or scope declarations rather than uses. */
    private static final Set<String> DECLARATION_ONLY_PARENTS = Set.of(
            "dotted_name",
            "aliased_import",
            "relative_import",
            "import_prefix",
            "global_statement",
            "nonlocal_statement");

    private static final Set<String> PARAMETER_LISTS = Set.of("parameters", "lambda_parameters");

    private final TSLanguage language;

    public PythonTreeSitterParser() {
        this.language = new TreeSitterPython();
    }

    @Override
    public ParserCapability capability() {
        return ParserCapability.EXACT_GRAMMAR;
    }

    private record Parsed(TSTree tree, TSNode root, SourceText source) {
        boolean hasError() {
            return root.hasError();
        }
    }

    private Parsed parse(String source) {
        var parser = new TSParser();
        parser.setLanguage(language);
        TSTree tree = parser.parseString(null, source);
        return new Parsed(tree, tree.getRootNode(), new SourceText(source));
    }

    // ---------------------------------------------------------------------------------------------
    // declarations

    @Override
    public FileSymbolTable extract(ProjectFile file, String source) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            logger.debug("Syntax errors in {}; returning an empty symbol table", file);
            return FileSymbolTable.empty(ParserCapability.EXACT_GRAMMAR);
        }
        var src = parsed.source();
        var root = parsed.root();

        var functions = new ArrayList<FunctionDecl>();
        var classes = new ArrayList<ClassDecl>();
        var imports = new ArrayList<ImportDecl>();
        for (var node : ASTTraversalUtils.findAllNodesRecursive(root, n -> {
            var type = n.getType();
            return FUNCTION_DEFINITION.equals(type)
                    || CLASS_DEFINITION.equals(type)
                    || "import_statement".equals(type)
                    || "import_from_statement".equals(type)
                    || "future_import_statement".equals(type);
        })) {
            switch (node.getType()) {
                case FUNCTION_DEFINITION -> functions.add(toFunctionDecl(node, src));
                case CLASS_DEFINITION -> classes.add(toClassDecl(node, src));
                default -> imports.addAll(toImportDecls(node, src));
            }
        }

        var variables = new ArrayList<VariableDecl>();
        var assignments = new ArrayList<AssignmentDecl>();
        var annotations = new ArrayList<AnnotationDecl>();
        for (var statement : namedChildren(root)) {
            var assignment = moduleAssignment(statement);
            if (assignment == null) {
                continue;
            }
            int line = startLine(assignment);
            var left = field(assignment, "left");
            var right = field(assignment, "right");
            var type = field(assignment, "type");
            String valueRepr = right == null ? "" : truncate(text(right, src), VALUE_LIMIT);
            assignments.add(new AssignmentDecl(text(left, src), line, valueRepr));
            if (left != null && IDENTIFIER.equals(left.getType())) {
                var name = text(left, src);
                variables.add(new VariableDecl(name, line, valueRepr));
                if (type != null) {
                    annotations.add(new AnnotationDecl(name, text(type, src), line));
                }
            }
        }

        logger.trace(
                "Extracted {} functions, {} classes, {} imports from {}",
                functions.size(),
                classes.size(),
                imports.size(),
                file);
        return new FileSymbolTable(
                functions, classes, variables, imports, assignments, annotations, ParserCapability.EXACT_GRAMMAR);
    }

    private FunctionDecl toFunctionDecl(TSNode node, SourceText src) {
        var name = text(field(node, "name"), src);
        var params = new ArrayList<String>();
        var parameters = field(node, "parameters");
        if (parameters != null) {
            for (var p : namedChildren(parameters)) {
                var paramName = parameterName(p, src);
                if (paramName != null) {
                    params.add(paramName);
                }
            }
        }
        boolean isAsync = false;
        for (int i = 0; i < node.getChildCount(); i++) {
            if ("async".equals(node.getChild(i).getType())) {
                isAsync = true;
                break;
            }
        }
        return new FunctionDecl(
                name,
                startLine(node),
                endLine(node),
                params,
                docstring(field(node, "body"), src),
                decorators(node, src),
                isAsync);
    }

    private ClassDecl toClassDecl(TSNode node, SourceText src) {
        var bases = new ArrayList<String>();
        var superclasses = field(node, "superclasses");
        if (superclasses != null) {
            for (var base : namedChildren(superclasses)) {
                if (!KEYWORD_ARGUMENT.equals(base.getType()) && !COMMENT.equals(base.getType())) {
                    bases.add(text(base, src));
                }
            }
        }
        var methods = new ArrayList<String>();
        var body = field(node, "body");
        if (body != null) {
            for (var member : namedChildren(body)) {
                var def = unwrapDecorated(member);
                if (FUNCTION_DEFINITION.equals(def.getType())) {
                    methods.add(text(field(def, "name"), src));
                }
            }
        }
        return new ClassDecl(
                text(field(node, "name"), src), startLine(node), endLine(node), bases, methods, docstring(body, src));
    }

    private List<ImportDecl> toImportDecls(TSNode node, SourceText src) {
        var result = new ArrayList<ImportDecl>();
        int line = startLine(node);
        switch (node.getType()) {
            case "import_statement" -> {
                for (var child : namedChildren(node)) {
                    var name = importedName(child, src);
                    if (name != null) {
                        result.add(new ImportDecl(name, "", line, ImportKind.IMPORT));
                    }
                }
            }
            case "future_import_statement" -> {
                for (var child : namedChildren(node)) {
                    var name = importedName(child, src);
                    if (name != null) {
                        result.add(new ImportDecl(name, "__future__", line, ImportKind.FROM));
                    }
                }
            }
            default -> {
                var module = field(node, "module_name");
                var source = text(module, src);
                for (var child : namedChildren(node)) {
                    if (sameNode(child, module)) {
                        continue;
                    }
                    if ("wildcard_import".equals(child.getType())) {
                        result.add(new ImportDecl("*", source, line, ImportKind.FROM));
                        continue;
                    }
                    var name = importedName(child, src);
                    if (name != null) {
                        result.add(new ImportDecl(name, source, line, ImportKind.FROM));
                    }
                }
            }
        }
        return result;
    }

    private static @Nullable String importedName(TSNode child, SourceText src) {
        return switch (child.getType()) {
            case "dotted_name" -> text(child, src);
            case "aliased_import" -> text(field(child, "name"), src);
            default -> null;
        };
    }

    /** The assignment node of a module-level {@code x = ...} or {@code x: T = ...} statement. */
    private static @Nullable TSNode moduleAssignment(TSNode statement) {
        if (!EXPRESSION_STATEMENT.equals(statement.getType()) || statement.getNamedChildCount() != 1) {
            return null;
        }
        var expr = statement.getNamedChild(0);
        return ASSIGNMENT.equals(expr.getType()) ? expr : null;
    }

    private static @Nullable String parameterName(TSNode param, SourceText src) {
        return switch (param.getType()) {
            case IDENTIFIER, "list_splat_pattern", "dictionary_splat_pattern" -> text(param, src);
            case "typed_parameter" -> param.getNamedChildCount() > 0 ? text(param.getNamedChild(0), src) : null;
            case "default_parameter", "typed_default_parameter" -> text(field(param, "name"), src);
            default -> null; // separators and comments
        };
    }

    private static List<String> decorators(TSNode definition, SourceText src) {
        var decorated = parent(definition);
        if (decorated == null || !DECORATED_DEFINITION.equals(decorated.getType())) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (var child : namedChildren(decorated)) {
            if (DECORATOR.equals(child.getType())) {
                var raw = text(child, src).strip();
                result.add(raw.startsWith("@") ? raw.substring(1).strip() : raw);
            }
        }
        return result;
    }

    private static TSNode unwrapDecorated(TSNode node) {
        if (DECORATED_DEFINITION.equals(node.getType())) {
            var def = field(node, "definition");
            if (def != null) {
                return def;
            }
        }
        return node;
    }

    /** First line of the definition including its decorators. */
    private static int blockStartLine(TSNode definition) {
        var p = parent(definition);
        if (p != null && DECORATED_DEFINITION.equals(p.getType())) {
            return startLine(p);
        }
        return startLine(definition);
    }

    static String docstring(@Nullable TSNode body, SourceText src) {
        if (body == null || body.getNamedChildCount() == 0) {
            return "";
        }
        var first = body.getNamedChild(0);
        if (!EXPRESSION_STATEMENT.equals(first.getType()) || first.getNamedChildCount() != 1) {
            return "";
        }
        var literal = first.getNamedChild(0);
        if (!STRING.equals(literal.getType())) {
            return "";
        }
        return truncate(cleanDoc(stripQuotes(text(literal, src))), DOC_LIMIT);
    }

    static String stripQuotes(String literal) {
        int i = 0;
        while (i < literal.length() && "rRbBuUfF".indexOf(literal.charAt(i)) >= 0) {
            i++;
        }
        var s = literal.substring(i);
        for (var quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (s.length() >= 2 * quote.length() && s.startsWith(quote) && s.endsWith(quote)) {
                return s.substring(quote.length(), s.length() - quote.length());
            }
        }
        return s;
    }

    private static String cleanDoc(String doc) {
        var sb = new StringBuilder();
        for (var line : doc.strip().split("\n", -1)) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.strip());
        }
        return sb.toString();
    }

    static String truncate(String s, int limit) {
        return s.length() <= limit ? s : s.substring(0, limit);
    }

    // ---------------------------------------------------------------------------------------------
    // occurrences

    @Override
    public List<SymbolOccurrence> occurrences(ProjectFile file, String source) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            logger.debug("Syntax errors in {}; no occurrences recorded", file);
            return List.of();
        }
        var src = parsed.source();
        var path = file.toString();
        var result = new ArrayList<SymbolOccurrence>();
        var stack = new ArrayDeque<TSNode>();
        stack.push(parsed.root());
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var type = node.getType();
            if (FUNCTION_DEFINITION.equals(type) || CLASS_DEFINITION.equals(type)) {
                var name = field(node, "name");
                if (name != null) {
                    result.add(new SymbolOccurrence(path, startLine(node), OccurrenceKind.DEFINITION, text(name, src)));
                }
            } else if (IDENTIFIER.equals(type)) {
                var kind = classify(node);
                if (kind != null) {
                    result.add(new SymbolOccurrence(path, startLine(node), kind, text(node, src)));
                }
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                var child = node.getChild(i);
                if (!ASTTraversalUtils.isNull(child)) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    /** Occurrence kind of an identifier token, or null when the token declares rather than uses a name. */
    private static @Nullable OccurrenceKind classify(TSNode identifier) {
        var p = parent(identifier);
        if (p == null) {
            return OccurrenceKind.REF;
        }
        var parentType = p.getType();
        if (DECLARATION_ONLY_PARENTS.contains(parentType) || PARAMETER_LISTS.contains(parentType)) {
            return null;
        }
        switch (parentType) {
            case FUNCTION_DEFINITION, CLASS_DEFINITION -> {
                if (isField(p, "name", identifier)) {
                    return null; // reported once as the definition
                }
            }
            // the annotation of a typed parameter sits under a `type` node, so a direct identifier is the name
            case "typed_parameter" -> {
                return null;
            }
            case "default_parameter", "typed_default_parameter", KEYWORD_ARGUMENT -> {
                if (isField(p, "name", identifier)) {
                    return null;
                }
            }
            case "list_splat_pattern", "dictionary_splat_pattern" -> {
                var gp = parent(p);
                if (gp != null && (PARAMETER_LISTS.contains(gp.getType()) || "typed_parameter".equals(gp.getType()))) {
                    return null;
                }
            }
            case CALL -> {
                if (isField(p, "function", identifier)) {
                    return OccurrenceKind.CALL;
                }
            }
            case ATTRIBUTE -> {
                if (isField(p, "attribute", identifier)) {
                    var gp = parent(p);
                    if (gp != null && CALL.equals(gp.getType()) && isField(gp, "function", p)) {
                        return OccurrenceKind.CALL;
                    }
                    return OccurrenceKind.ATTR;
                }
            }
            default -> {}
        }
        return isStoreTarget(identifier) ? OccurrenceKind.STORE : OccurrenceKind.REF;
    }

    private static boolean isStoreTarget(TSNode identifier) {
        var current = identifier;
        var p = parent(current);
        while (p != null && TARGET_CONTAINERS.contains(p.getType())) {
            current = p;
            p = parent(current);
        }
        if (p == null) {
            return false;
        }
        return switch (p.getType()) {
            case ASSIGNMENT, AUGMENTED_ASSIGNMENT, "for_statement", "for_in_clause" -> isField(p, "left", current);
            case "named_expression" -> isField(p, "name", current);
            case "as_pattern_target" -> true;
            default -> false;
        };
    }

    // ---------------------------------------------------------------------------------------------
    // rename support

    @Override
    public List<TokenSpan> identifierSpans(String source, String name) {
        // syntax errors do not stop a rename: every identifier token the parser recovered is still a name
        var parsed = parse(source);
        var src = parsed.source();
        var spans = new ArrayList<TokenSpan>();
        for (var node : ASTTraversalUtils.findAllNodesRecursive(
                parsed.root(), n -> IDENTIFIER.equals(n.getType()) && n.getChildCount() == 0)) {
            if (!name.equals(text(node, src))) {
                continue;
            }
            int start = src.charOffset(node.getStartByte());
            int line = src.lineOf(start);
            int col = start - src.lineStart(line);
            spans.add(new TokenSpan(line, col, col + name.length()));
        }
        return spans;
    }

    // ---------------------------------------------------------------------------------------------
    // context blocks

    @Override
    public List<CodeBlock> blocks(ProjectFile file, String source) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            logger.debug("Syntax errors in {}; no blocks", file);
            return List.of();
        }
        var src = parsed.source();
        var result = new ArrayList<CodeBlock>();
        for (var statement : namedChildren(parsed.root())) {
            var def = unwrapDecorated(statement);
            switch (def.getType()) {
                case FUNCTION_DEFINITION -> result.add(definitionBlock(def, CodeBlock.Kind.FUNCTION, "", src));
                case CLASS_DEFINITION -> {
                    var cls = definitionBlock(def, CodeBlock.Kind.CLASS, "", src);
                    result.add(cls);
                    var body = field(def, "body");
                    if (body != null) {
                        for (var member : namedChildren(body)) {
                            var method = unwrapDecorated(member);
                            if (FUNCTION_DEFINITION.equals(method.getType())) {
                                result.add(definitionBlock(method, CodeBlock.Kind.METHOD, cls.name() + ".", src));
                            }
                        }
                    }
                }
                default -> {
                    var constant = constantBlock(statement, src);
                    if (constant != null) {
                        result.add(constant);
                    }
                }
            }
        }
        return result;
    }

    private static CodeBlock definitionBlock(TSNode def, CodeBlock.Kind kind, String prefix, SourceText src) {
        var name = prefix + text(field(def, "name"), src);
        int end = endLine(def);
        return new CodeBlock(
                name,
                kind,
                startLine(def),
                end,
                src.lines(blockStartLine(def), end),
                docstring(field(def, "body"), src));
    }

    /** {@code MAX_RETRIES = 3} style module constants. */
    private static @Nullable CodeBlock constantBlock(TSNode statement, SourceText src) {
        var assignment = moduleAssignment(statement);
        if (assignment == null) {
            return null;
        }
        var left = field(assignment, "left");
        var right = field(assignment, "right");
        if (left == null || right == null || !IDENTIFIER.equals(left.getType())) {
            return null;
        }
        var name = text(left, src);
        if (!isUpperCase(name)) {
            return null;
        }
        int line = startLine(assignment);
        var value = truncate(text(right, src), VALUE_LIMIT);
        return new CodeBlock(name, CodeBlock.Kind.VARIABLE, line, line, name + " = " + value, "");
    }

    /** At least one cased character and no lower-case ones. */
    static boolean isUpperCase(String name) {
        boolean cased = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    @Override
    public Optional<CodeBlock> findDefinition(String source, String name) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            return Optional.empty();
        }
        var src = parsed.source();
        var def = ASTTraversalUtils.findNodeBreadthFirst(parsed.root(), n -> {
            var type = n.getType();
            return (FUNCTION_DEFINITION.equals(type) || CLASS_DEFINITION.equals(type))
                    && name.equals(text(field(n, "name"), src));
        });
        if (def == null) {
            return Optional.empty();
        }
        var kind = CLASS_DEFINITION.equals(def.getType()) ? CodeBlock.Kind.CLASS : CodeBlock.Kind.FUNCTION;
        return Optional.of(definitionBlock(def, kind, "", src));
    }

    // ---------------------------------------------------------------------------------------------
    // signature migration support

    @Override
    public Optional<List<String>> positionalParameters(String source, String functionName) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            return Optional.empty();
        }
        var src = parsed.source();
        var def = ASTTraversalUtils.findNodeBreadthFirst(
                parsed.root(),
                n -> FUNCTION_DEFINITION.equals(n.getType()) && functionName.equals(text(field(n, "name"), src)));
        if (def == null) {
            return Optional.empty();
        }
        var names = new ArrayList<String>();
        var parameters = field(def, "parameters");
        if (parameters != null) {
            for (var p : namedChildren(parameters)) {
                var type = p.getType();
                if ("positional_separator".equals(type) || COMMENT.equals(type)) {
                    continue;
                }
                // everything after *args, a bare * or **kwargs is keyword-only
                if ("keyword_separator".equals(type)
                        || "list_splat_pattern".equals(type)
                        || "dictionary_splat_pattern".equals(type)
                        || ("typed_parameter".equals(type)
                                && p.getNamedChildCount() > 0
                                && !IDENTIFIER.equals(p.getNamedChild(0).getType()))) {
                    break;
                }
                var name = parameterName(p, src);
                if (name != null) {
                    names.add(name);
                }
            }
        }
        return Optional.of(names);
    }

    @Override
    public List<CallSite> callSites(String source, String functionName) {
        var parsed = parse(source);
        if (parsed.hasError()) {
            logger.debug("Skipping call-site scan for {}: syntax errors", functionName);
            return List.of();
        }
        var src = parsed.source();
        var result = new ArrayList<CallSite>();
        for (var call : ASTTraversalUtils.findAllNodesByType(parsed.root(), CALL)) {
            var callee = field(call, "function");
            if (callee == null || !functionName.equals(calleeName(callee, src))) {
                continue;
            }
            var arguments = field(call, "arguments");
            if (arguments == null) {
                continue;
            }
            result.add(toCallSite(arguments, src));
        }
        return result;
    }

    private static String calleeName(TSNode callee, SourceText src) {
        return switch (callee.getType()) {
            case IDENTIFIER -> text(callee, src);
            case ATTRIBUTE -> text(field(callee, "attribute"), src);
            default -> "";
        };
    }

    private static CallSite toCallSite(TSNode arguments, SourceText src) {
        int start = src.charOffset(arguments.getStartByte());
        int end = src.charOffset(arguments.getEndByte());
        var positional = new ArrayList<String>();
        var keywords = new ArrayList<CallSite.KeywordArgument>();
        // f(x for x in xs) passes a bare generator_expression instead of an argument_list
        boolean unpacking = !ARGUMENT_LIST.equals(arguments.getType());
        if (!unpacking) {
            for (var arg : namedChildren(arguments)) {
                switch (arg.getType()) {
                    case COMMENT -> {}
                    case KEYWORD_ARGUMENT -> keywords.add(
                            new CallSite.KeywordArgument(text(field(arg, "name"), src), text(arg, src)));
                    case "list_splat", "dictionary_splat", "parenthesized_list_splat" -> unpacking = true;
                    default -> positional.add(text(arg, src));
                }
            }
        }
        return new CallSite(
                src.lineOf(start), start, end, src.text().substring(start, end), positional, keywords, unpacking);
    }
}
