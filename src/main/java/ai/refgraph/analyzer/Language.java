package ai.refgraph.analyzer;

import java.util.List;

public interface Language {
    List<String> getExtensions();

    String name(); // Human-friendly

    String internalName(); // Filesystem-safe

    /**
     * The parser for this language, created on first use. Loading the exact-grammar parser pulls in native
     * tree-sitter code, so nothing should ask for it until a file of that language is actually parsed.
     */
    ISymbolParser getParser();

    default ParserCapability capability() {
        return getParser().capability();
    }
}
