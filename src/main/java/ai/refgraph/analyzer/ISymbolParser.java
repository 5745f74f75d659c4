package ai.refgraph.analyzer;

import java.util.List;
import java.util.Optional;

/**
 * Extracts declarations and name occurrences from the text of one file. Implementations are pure: they never touch
 * the filesystem, and a file that cannot be parsed yields empty results instead of an exception.
 */
public interface ISymbolParser {
    ParserCapability capability();

    FileSymbolTable extract(ProjectFile file, String source);

    /** Every use-site of every name in the file, in source order. */
    List<SymbolOccurrence> occurrences(ProjectFile file, String source);

    /**
     * Locations of identifier tokens spelled exactly {@code name}. Unlike {@link #occurrences}, this also reports
     * parameter names, keyword-argument names and import aliases: everything a rename has to touch.
     */
    List<TokenSpan> identifierSpans(String source, String name);

    /** Top-level blocks suitable for handing to a reader as context. */
    List<CodeBlock> blocks(ProjectFile file, String source);

    /** The first function or class declaration named {@code name}, decorators included. */
    Optional<CodeBlock> findDefinition(String source, String name);

    /**
     * Parameters of the first function named {@code functionName} that can be passed positionally, in declaration
     * order. Empty when the function is not declared here or the parser cannot tell.
     */
    default Optional<List<String>> positionalParameters(String source, String functionName) {
        return Optional.empty();
    }

    /** Calls whose callee is {@code functionName}, either bare or as an attribute. */
    default List<CallSite> callSites(String source, String functionName) {
        return List.of();
    }
}
