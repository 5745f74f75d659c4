package ai.refgraph.refactor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** One parameter of a new signature: {@code name} or {@code name=defaultExpr}. */
public record ParamSpec(String name, @Nullable String defaultExpr) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ParamSpec {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid parameter name '" + name + "'");
        }
    }

    public Optional<String> defaultValue() {
        return Optional.ofNullable(defaultExpr);
    }

    /**
     * Parses {@code "name"} or {@code "name=expr"}. Leading {@code *} markers are dropped, so {@code *args} names the
     * parameter {@code args}.
     *
     * @throws IllegalArgumentException when the name is not an identifier or the default is empty
     */
    public static ParamSpec parse(String spec) {
        int eq = spec.indexOf('=');
        var rawName = eq < 0 ? spec : spec.substring(0, eq);
        var name = rawName.strip().replaceFirst("^\\*+", "");
        // drop an annotation: "loud: bool=False"
        int colon = name.indexOf(':');
        if (colon >= 0) {
            name = name.substring(0, colon).strip();
        }
        if (eq < 0) {
            return new ParamSpec(name, null);
        }
        var defaultExpr = spec.substring(eq + 1).strip();
        if (defaultExpr.isEmpty()) {
            throw new IllegalArgumentException("Missing default value in '" + spec.strip() + "'");
        }
        return new ParamSpec(name, defaultExpr);
    }

    /**
     * Parses a comma-separated parameter list such as {@code "name, loud=False, opts=(1, 2)"}. Commas inside
     * brackets or string literals do not split.
     */
    public static List<ParamSpec> parseList(String specs) {
        var result = new ArrayList<ParamSpec>();
        for (var part : splitTopLevel(specs)) {
            if (!part.isBlank()) {
                result.add(parse(part));
            }
        }
        return result;
    }

    static List<String> splitTopLevel(String text) {
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                default -> {}
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    @Override
    public String toString() {
        return defaultExpr == null ? name : name + "=" + defaultExpr;
    }
}
