package ai.refgraph;

import ai.refgraph.analyzer.ProjectFile;
import ai.refgraph.util.AtomicWrites;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Exact-match search/replace patching. The same primitive serves hand-written and generated edits: the search text
 * must occur verbatim, and only its first occurrence is replaced. There is no fuzzy fallback; a miss is reported as
 * {@link PatchResult.NoMatch} so the caller can regenerate the patch.
 */
public class EditBlock {
    private static final Logger logger = LogManager.getLogger(EditBlock.class);

    // the SEARCH and REPLACE labels are optional on the fences
    private static final Pattern HEAD = Pattern.compile("^<{5,9}(?:\\s*SEARCH)?\\s*$");
    private static final Pattern DIVIDER = Pattern.compile("^={5,9}\\s*$");
    private static final Pattern UPDATED = Pattern.compile("^>{5,9}(?:\\s*REPLACE)?\\s*$");
    private static final Pattern SEARCH_LABEL = Pattern.compile("^SEARCH:\\s*$");
    private static final Pattern REPLACE_LABEL = Pattern.compile("^REPLACE:\\s*$");
    private static final String FENCE = "```";

    private EditBlock() {
        // utility class
    }

    public sealed interface PatchResult {
        record Applied(String text) implements PatchResult {}

        /** The search text was empty, so the replacement went at the end of the file. */
        record Appended(String text) implements PatchResult {}

        record NoMatch(String search) implements PatchResult {}

        default boolean matched() {
            return !(this instanceof NoMatch);
        }
    }

    public enum EditBlockFailureReason {
        FILE_NOT_FOUND,
        NO_MATCH,
        IO_ERROR
    }

    /**
     * @param originalContents contents of every file that was changed, before the first change
     */
    public record EditResult(Map<ProjectFile, String> originalContents, List<FailedBlock> failedBlocks) {
        public boolean hadSuccessfulEdits() {
            return !originalContents.isEmpty();
        }
    }

    public record FailedBlock(SearchReplaceBlock block, EditBlockFailureReason reason, String commentary) {
        public FailedBlock(SearchReplaceBlock block, EditBlockFailureReason reason) {
            this(block, reason, "");
        }
    }

    /** If {@code filename} is null the block was not preceded by a filename line. */
    public record SearchReplaceBlock(@Nullable String filename, String beforeText, String afterText) {}

    public record ParseResult(List<SearchReplaceBlock> blocks, @Nullable String parseError) {}

    /**
     * Replaces the first occurrence of {@code search} in {@code original} with {@code replace}. An empty search
     * appends the stripped replacement after the stripped original, separated by a blank line. Whitespace-only
     * search text is matched like any other.
     */
    public static PatchResult applyPatch(String original, String search, String replace) {
        if (search.isEmpty()) {
            if (original.isBlank()) {
                return new PatchResult.Appended(replace.strip() + "\n");
            }
            return new PatchResult.Appended(original.stripTrailing() + "\n\n" + replace.strip() + "\n");
        }
        int idx = original.indexOf(search);
        if (idx < 0) {
            return new PatchResult.NoMatch(search);
        }
        return new PatchResult.Applied(
                original.substring(0, idx) + replace + original.substring(idx + search.length()));
    }

    /**
     * Patches a file in place. A missing file is treated as empty, so an empty search creates it. Nothing is written
     * on {@link PatchResult.NoMatch}.
     */
    public static PatchResult applyToFile(ProjectFile file, String search, String replace) throws IOException {
        var original = file.exists() ? file.read() : "";
        var result = applyPatch(original, search, replace);
        if (result instanceof PatchResult.Applied applied) {
            AtomicWrites.atomicOverwrite(file.absPath(), applied.text());
        } else if (result instanceof PatchResult.Appended appended) {
            AtomicWrites.atomicOverwrite(file.absPath(), appended.text());
        } else {
            logger.debug("Search text not found in {}", file);
        }
        return result;
    }

    /**
     * Applies parsed blocks in order. Blocks for the same file see the effect of the blocks before them. Failures are
     * collected; processing continues with the next block.
     */
    public static EditResult apply(IProject project, Collection<SearchReplaceBlock> blocks) {
        var failed = new ArrayList<FailedBlock>();
        var changedFiles = new LinkedHashMap<ProjectFile, String>();

        for (var block : blocks) {
            if (block.filename() == null || block.filename().isBlank()) {
                logger.debug("Block is missing a filename");
                failed.add(new FailedBlock(block, EditBlockFailureReason.FILE_NOT_FOUND));
                continue;
            }
            var file = project.toFile(block.filename());
            if (!file.exists() && !block.beforeText().isEmpty()) {
                failed.add(new FailedBlock(block, EditBlockFailureReason.FILE_NOT_FOUND));
                continue;
            }
            try {
                var original = file.exists() ? file.read() : "";
                var result = applyToFile(file, block.beforeText(), block.afterText());
                if (result instanceof PatchResult.NoMatch) {
                    var commentary = original.contains(block.afterText()) && !block.afterText().isBlank()
                            ? "The replacement text is already present in the file."
                            : "";
                    failed.add(new FailedBlock(block, EditBlockFailureReason.NO_MATCH, commentary));
                    continue;
                }
                changedFiles.putIfAbsent(file, original);
            } catch (IOException e) {
                logger.error("Error applying edit to {}: {}", file, e.getMessage());
                failed.add(new FailedBlock(block, EditBlockFailureReason.IO_ERROR, e.getMessage()));
            }
        }
        return new EditResult(changedFiles, failed);
    }

    /**
     * Parses {@code <<<<<<< SEARCH / ======= / >>>>>>> REPLACE} blocks; bare {@code <<<<<<<} and {@code >>>>>>>}
     * fences are accepted too. A block may be preceded by a line naming the file, optionally with an opening code
     * fence between them. Text outside blocks is ignored. Content without any fenced block is read in the
     * {@code SEARCH:} / {@code REPLACE:} label style instead.
     */
    public static ParseResult parseSearchReplaceBlocks(String content) {
        var lines = content.split("\n", -1);
        if (Arrays.stream(lines).noneMatch(line -> HEAD.matcher(line.strip()).matches())) {
            return parseLabelledBlocks(lines);
        }
        var blocks = new ArrayList<SearchReplaceBlock>();
        int i = 0;
        while (i < lines.length) {
            if (!HEAD.matcher(lines[i].strip()).matches()) {
                i++;
                continue;
            }
            var filename = filenameAbove(lines, i);

            i++;
            var beforeLines = new ArrayList<String>();
            while (i < lines.length && !DIVIDER.matcher(lines[i].strip()).matches()) {
                beforeLines.add(lines[i]);
                i++;
            }
            if (i >= lines.length) {
                return new ParseResult(blocks, "Expected ======= divider after <<<<<<< SEARCH");
            }

            i++;
            var afterLines = new ArrayList<String>();
            while (i < lines.length && !UPDATED.matcher(lines[i].strip()).matches()) {
                afterLines.add(lines[i]);
                i++;
            }
            if (i >= lines.length) {
                return new ParseResult(blocks, "Expected >>>>>>> REPLACE after =======");
            }
            i++;

            blocks.add(new SearchReplaceBlock(filename, joinLines(beforeLines), joinLines(afterLines)));
        }
        return new ParseResult(blocks, null);
    }

    /**
     * {@code SEARCH:} on its own line, the search text, {@code REPLACE:}, then the replacement up to the next
     * {@code SEARCH:} or the end of the content. Blocks carry no filename.
     */
    private static ParseResult parseLabelledBlocks(String[] lines) {
        var blocks = new ArrayList<SearchReplaceBlock>();
        int i = 0;
        while (i < lines.length) {
            if (!SEARCH_LABEL.matcher(lines[i].strip()).matches()) {
                i++;
                continue;
            }
            i++;
            var beforeLines = new ArrayList<String>();
            while (i < lines.length && !REPLACE_LABEL.matcher(lines[i].strip()).matches()) {
                beforeLines.add(lines[i]);
                i++;
            }
            if (i >= lines.length) {
                return new ParseResult(blocks, "Expected REPLACE: after SEARCH:");
            }
            i++;
            var afterLines = new ArrayList<String>();
            while (i < lines.length && !SEARCH_LABEL.matcher(lines[i].strip()).matches()) {
                afterLines.add(lines[i]);
                i++;
            }
            blocks.add(new SearchReplaceBlock(
                    null, joinLines(trimBlankEdges(beforeLines)), joinLines(trimBlankEdges(afterLines))));
        }
        return new ParseResult(blocks, null);
    }

    private static List<String> trimBlankEdges(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isEmpty()) {
            from++;
        }
        while (to > from && lines.get(to - 1).isEmpty()) {
            to--;
        }
        return lines.subList(from, to);
    }

    private static String joinLines(List<String> lines) {
        var joined = String.join("\n", lines);
        return joined.isEmpty() || joined.endsWith("\n") ? joined : joined + "\n";
    }

    /** The filename line directly above a HEAD marker, looking past one opening fence. */
    private static @Nullable String filenameAbove(String[] lines, int headIndex) {
        int j = headIndex - 1;
        if (j >= 0 && lines[j].strip().startsWith(FENCE)) {
            j--;
        }
        if (j < 0) {
            return null;
        }
        var candidate = lines[j].strip();
        if (candidate.isEmpty()
                || candidate.startsWith(FENCE)
                || UPDATED.matcher(candidate).matches()
                || candidate.contains(" ")) {
            return null;
        }
        return candidate.replace("`", "");
    }
}
