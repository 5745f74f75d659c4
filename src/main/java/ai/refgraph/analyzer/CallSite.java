package ai.refgraph.analyzer;

import java.util.List;

/**
 * A call to a named function together with its argument list.
 *
 * @param line line of the opening parenthesis
 * @param argsStart char offset of the opening parenthesis within the file
 * @param argsEnd char offset just past the closing parenthesis
 * @param argumentText the parenthesized argument list exactly as written
 * @param positionalArgs positional argument expressions, verbatim
 * @param keywordArgs keyword arguments in source order
 * @param hasUnpacking true when the call spreads {@code *args} or {@code **kwargs}, or passes a bare generator
 */
public record CallSite(
        int line,
        int argsStart,
        int argsEnd,
        String argumentText,
        List<String> positionalArgs,
        List<KeywordArgument> keywordArgs,
        boolean hasUnpacking) {

    public CallSite {
        positionalArgs = List.copyOf(positionalArgs);
        keywordArgs = List.copyOf(keywordArgs);
    }

    /** {@code text} is the full {@code name=value} argument as written. */
    public record KeywordArgument(String name, String text) {}

    public boolean passesByKeyword(String paramName) {
        return keywordArgs.stream().anyMatch(k -> k.name().equals(paramName));
    }
}
