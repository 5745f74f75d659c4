package ai.refgraph.context;

import ai.refgraph.analyzer.CodeBlock;

/**
 * A retrievable unit of source: one function, class, method or constant (or a heuristic block for languages
 * without an exact grammar).
 *
 * @param symbol declared name; methods are qualified as {@code Class.method}
 * @param sourceText the block's source, decorators included
 * @param relevanceScore zero until scored against a query
 */
public record Chunk(
        String file,
        String symbol,
        CodeBlock.Kind kind,
        int startLine,
        int endLine,
        String sourceText,
        String doc,
        double relevanceScore) {

    static Chunk of(String file, CodeBlock block) {
        return new Chunk(
                file, block.name(), block.kind(), block.startLine(), block.endLine(), block.text(), block.doc(), 0.0);
    }

    public Chunk withScore(double score) {
        return new Chunk(file, symbol, kind, startLine, endLine, sourceText, doc, score);
    }

    public int size() {
        return sourceText.length();
    }
}
