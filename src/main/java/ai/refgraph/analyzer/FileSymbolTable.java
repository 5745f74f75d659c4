package ai.refgraph.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Declarations found in one file. Line numbers are 1-based and inclusive. A table is never patched in place: when the
 * file's content hash changes the whole table is re-extracted.
 */
public record FileSymbolTable(
        @JsonProperty("functions") List<FunctionDecl> functions,
        @JsonProperty("classes") List<ClassDecl> classes,
        @JsonProperty("variables") List<VariableDecl> variables,
        @JsonProperty("imports") List<ImportDecl> imports,
        @JsonProperty("assignments") List<AssignmentDecl> assignments,
        @JsonProperty("annotations") List<AnnotationDecl> annotations,
        @JsonProperty("confidence") ParserCapability confidence) {

    public FileSymbolTable {
        functions = copy(functions);
        classes = copy(classes);
        variables = copy(variables);
        imports = copy(imports);
        assignments = copy(assignments);
        annotations = copy(annotations);
    }

    public static FileSymbolTable empty(ParserCapability confidence) {
        return new FileSymbolTable(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), confidence);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return functions.isEmpty()
                && classes.isEmpty()
                && variables.isEmpty()
                && imports.isEmpty()
                && assignments.isEmpty()
                && annotations.isEmpty();
    }

    private static <T> List<T> copy(@Nullable List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public record FunctionDecl(
            @JsonProperty("name") String name,
            @JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("params") List<String> params,
            @JsonProperty("doc") String doc,
            @JsonProperty("decorators") List<String> decorators,
            @JsonProperty("isAsync") boolean isAsync) {
        public FunctionDecl {
            params = copy(params);
            decorators = copy(decorators);
        }
    }

    public record ClassDecl(
            @JsonProperty("name") String name,
            @JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("bases") List<String> bases,
            @JsonProperty("methods") List<String> methods,
            @JsonProperty("doc") String doc) {
        public ClassDecl {
            bases = copy(bases);
            methods = copy(methods);
        }
    }

    public record VariableDecl(
            @JsonProperty("name") String name,
            @JsonProperty("start") int start,
            @JsonProperty("valueRepr") String valueRepr) {}

    public record ImportDecl(
            @JsonProperty("name") String name,
            @JsonProperty("source") String source,
            @JsonProperty("start") int start,
            @JsonProperty("kind") ImportKind kind) {}

    public record AssignmentDecl(
            @JsonProperty("target") String target,
            @JsonProperty("start") int start,
            @JsonProperty("valueRepr") String valueRepr) {}

    public record AnnotationDecl(
            @JsonProperty("name") String name,
            @JsonProperty("annotation") String annotation,
            @JsonProperty("start") int start) {}

    public enum ImportKind {
        IMPORT,
        FROM;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ImportKind fromWireName(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
