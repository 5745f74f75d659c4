package ai.refgraph.refactor;

import ai.refgraph.IProject;
import ai.refgraph.analyzer.ProjectFile;
import ai.refgraph.analyzer.SourceText;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renames an identifier across the project. Python files are rewritten token by token from the parse tree, so strings
 * and comments that happen to contain the name are left alone; other languages match the name on word boundaries
 * and may also hit text inside strings and comments.
 */
public class RenameEngine {
    private static final Logger logger = LogManager.getLogger(RenameEngine.class);

    static final int CONTEXT_LIMIT = 120;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final IProject project;
    private final SourceWriter writer;

    public RenameEngine(IProject project) {
        this(project, SourceWriter.DEFAULT);
    }

    public RenameEngine(IProject project, SourceWriter writer) {
        this.project = project;
        this.writer = writer;
    }

    /**
     * Computes every edit and, unless {@code dryRun}, writes the affected files one by one. A file that fails to write
     * is reported in {@code errors}; files already written stay written.
     */
    public RenameResult rename(String oldName, String newName, boolean dryRun) {
        if (!IDENTIFIER.matcher(oldName).matches() || !IDENTIFIER.matcher(newName).matches()) {
            return failed(oldName, newName, "Not a valid identifier: '%s' -> '%s'".formatted(oldName, newName));
        }
        if (oldName.equals(newName)) {
            return failed(oldName, newName, "Old and new names are the same: '%s'".formatted(oldName));
        }

        var edits = new ArrayList<Edit>();
        var errors = new ArrayList<String>();
        int filesWritten = 0;
        for (var file : project.getSourceFiles()) {
            String source;
            try {
                source = file.read();
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            if (!source.contains(oldName)) {
                continue;
            }
            var fileEdits = editsFor(file, source, oldName, newName);
            if (fileEdits.isEmpty()) {
                continue;
            }
            edits.addAll(fileEdits);
            if (dryRun) {
                continue;
            }
            try {
                writer.write(file, EditApplier.apply(file.read(), fileEdits));
                filesWritten++;
                logger.debug("Renamed {} site(s) in {}", fileEdits.size(), file);
            } catch (IOException | StaleEditException e) {
                errors.add(file + ": " + e.getMessage());
                logger.warn("Rename of {} failed in {}: {}", oldName, file, e.getMessage());
            }
        }

        boolean applied = !dryRun && errors.isEmpty();
        logger.info(
                "Rename {} -> {}: {} edit(s), {} file(s) written, {} error(s){}",
                oldName,
                newName,
                edits.size(),
                filesWritten,
                errors.size(),
                dryRun ? " (dry run)" : "");
        return new RenameResult(oldName, newName, edits, errors, applied);
    }

    private static List<Edit> editsFor(ProjectFile file, String source, String oldName, String newName) {
        var src = new SourceText(source);
        var path = file.toString();
        return file.getLanguage().getParser().identifierSpans(source, oldName).stream()
                .map(span -> new Edit(
                        path,
                        span.line(),
                        span.colStart(),
                        span.colEnd(),
                        oldName,
                        newName,
                        context(src, span.line())))
                .toList();
    }

    static String context(SourceText src, int line) {
        var text = src.line(line).strip();
        return text.length() <= CONTEXT_LIMIT ? text : text.substring(0, CONTEXT_LIMIT);
    }

    private static RenameResult failed(String oldName, String newName, String error) {
        return new RenameResult(oldName, newName, List.of(), List.of(error), false);
    }
}
