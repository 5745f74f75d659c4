package ai.refgraph.graph.usages;

import ai.refgraph.analyzer.OccurrenceKind;

/**
 * A single usage site with the text of its line.
 *
 * @param file project-relative path
 * @param line 1-based line
 * @param context the stripped source line, at most {@link UsageFinder#CONTEXT_LIMIT} chars
 */
public record UsageHit(String file, int line, OccurrenceKind kind, String context) {}
