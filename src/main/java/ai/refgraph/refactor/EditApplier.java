package ai.refgraph.refactor;

import ai.refgraph.analyzer.SourceText;
import java.util.Comparator;
import java.util.List;

/** Applies a file's edits to its current text, checking each one against what is actually there. */
public final class EditApplier {
    private EditApplier() {}

    /**
     * Applies the edits right to left so earlier offsets stay valid.
     *
     * @throws StaleEditException if any {@code oldText} is not found at its location, or two edits overlap; nothing is
     *     applied in that case
     */
    public static String apply(String source, List<Edit> edits) throws StaleEditException {
        var src = new SourceText(source);
        var ordered = edits.stream()
                .sorted(Comparator.comparingInt(Edit::line)
                        .thenComparingInt(Edit::colStart)
                        .reversed())
                .toList();
        var sb = new StringBuilder(source);
        int lowerBound = Integer.MAX_VALUE;
        for (var edit : ordered) {
            if (edit.line() < 1 || edit.line() > src.lineCount()) {
                throw new StaleEditException("line %d is past the end of the file".formatted(edit.line()));
            }
            int start = src.lineStart(edit.line()) + edit.colStart();
            int end = start + edit.oldText().length();
            if (end > lowerBound) {
                throw new StaleEditException("overlapping edits at line %d".formatted(edit.line()));
            }
            if (!source.startsWith(edit.oldText(), start)) {
                throw new StaleEditException("expected '%s' at line %d column %d"
                        .formatted(edit.oldText(), edit.line(), edit.colStart()));
            }
            sb.replace(start, end, edit.newText());
            lowerBound = start;
        }
        return sb.toString();
    }
}
