package ai.refgraph.refactor;

/**
 * One text substitution. {@code oldText} starts at {@code colStart} (0-based) on the 1-based {@code line} and may run
 * past the end of that line; {@code colEnd} is {@code colStart + oldText.length()}.
 *
 * @param context the stripped text of the edited line, for display
 */
public record Edit(String file, int line, int colStart, int colEnd, String oldText, String newText, String context) {}
