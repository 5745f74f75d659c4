package ai.refgraph.analyzer;

/**
 * A contiguous region of source that can be handed to a reader on its own: a function, class, method, constant or,
 * for heuristic languages, a fixed-size block following a declaration.
 *
 * @param startLine declaration line (decorators excluded), 1-based
 * @param text the block's source; decorators included
 */
public record CodeBlock(String name, Kind kind, int startLine, int endLine, String text, String doc) {
    public enum Kind {
        FUNCTION,
        CLASS,
        METHOD,
        VARIABLE,
        BLOCK
    }
}
