package ai.refgraph.analyzer;

/** Location of a single identifier token: 1-based line, 0-based char columns, end exclusive. */
public record TokenSpan(int line, int colStart, int colEnd) {}
