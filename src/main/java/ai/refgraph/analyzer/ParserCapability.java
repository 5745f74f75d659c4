package ai.refgraph.analyzer;

/** How much a parser's output can be trusted. */
public enum ParserCapability {
    /** Parsed with a real grammar; strings and comments are never mistaken for code. */
    EXACT_GRAMMAR,
    /** Line patterns and lexical context only. */
    HEURISTIC
}
