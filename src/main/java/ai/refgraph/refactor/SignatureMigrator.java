package ai.refgraph.refactor;

import ai.refgraph.IProject;
import ai.refgraph.analyzer.CallSite;
import ai.refgraph.analyzer.ParserCapability;
import ai.refgraph.analyzer.ProjectFile;
import ai.refgraph.analyzer.SourceText;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites call sites of a function after its parameter list changes. Only files parsed with an exact grammar take
 * part: a call's arguments have to be known precisely before they can be reordered.
 *
 * <p>The first definition found, scanning files in path order, supplies the old parameter list. Same-named functions
 * elsewhere are not told apart.
 */
public class SignatureMigrator {
    private static final Logger logger = LogManager.getLogger(SignatureMigrator.class);

    static final String MISSING_ARGUMENT = "None";

    private final IProject project;
    private final SourceWriter writer;

    public SignatureMigrator(IProject project) {
        this(project, SourceWriter.DEFAULT);
    }

    public SignatureMigrator(IProject project, SourceWriter writer) {
        this.project = project;
        this.writer = writer;
    }

    private record SourceFile(ProjectFile file, String text) {}

    public MigrationResult migrate(String functionName, List<ParamSpec> newParams, boolean dryRun) {
        var newParamText = newParams.stream().map(ParamSpec::toString).toList();
        var files = readCandidates(functionName);

        List<String> oldParams = null;
        for (var source : files) {
            var found = source.file().getLanguage().getParser().positionalParameters(source.text(), functionName);
            if (found.isPresent()) {
                oldParams = found.get();
                logger.debug("Using definition of {} in {}: ({})", functionName, source.file(), oldParams);
                break;
            }
        }
        if (oldParams == null) {
            return new MigrationResult(
                    functionName,
                    List.of(),
                    newParamText,
                    List.of(),
                    List.of("Could not find definition of '%s'".formatted(functionName)),
                    List.of(),
                    false);
        }

        var edits = new ArrayList<Edit>();
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        for (var source : files) {
            var fileEdits = editsFor(source, functionName, oldParams, newParams, warnings);
            if (fileEdits.isEmpty()) {
                continue;
            }
            edits.addAll(fileEdits);
            if (dryRun) {
                continue;
            }
            try {
                writer.write(source.file(), EditApplier.apply(source.file().read(), fileEdits));
                logger.debug("Rewrote {} call(s) in {}", fileEdits.size(), source.file());
            } catch (IOException | StaleEditException e) {
                errors.add(source.file() + ": " + e.getMessage());
                logger.warn("Migration of {} failed in {}: {}", functionName, source.file(), e.getMessage());
            }
        }

        logger.info(
                "Signature migration {}({}) -> ({}): {} call site(s) rewritten, {} skipped, {} error(s){}",
                functionName,
                String.join(", ", oldParams),
                String.join(", ", newParamText),
                edits.size(),
                warnings.size(),
                errors.size(),
                dryRun ? " (dry run)" : "");
        return new MigrationResult(
                functionName, oldParams, newParamText, edits, errors, warnings, !dryRun && errors.isEmpty());
    }

    /** Exact-grammar files mentioning the name, in path order. */
    private List<SourceFile> readCandidates(String functionName) {
        var result = new ArrayList<SourceFile>();
        for (var file : project.getSourceFiles()) {
            if (file.getLanguage().capability() != ParserCapability.EXACT_GRAMMAR) {
                continue;
            }
            try {
                var text = file.read();
                if (text.contains(functionName)) {
                    result.add(new SourceFile(file, text));
                }
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            }
        }
        return result;
    }

    private static List<Edit> editsFor(
            SourceFile source,
            String functionName,
            List<String> oldParams,
            List<ParamSpec> newParams,
            List<String> warnings) {
        var src = new SourceText(source.text());
        var path = source.file().toString();
        var edits = new ArrayList<Edit>();
        int acceptedEnd = -1;
        for (var call : source.file().getLanguage().getParser().callSites(source.text(), functionName)) {
            var where = path + ":" + call.line();
            if (call.hasUnpacking()) {
                warnings.add(where + ": argument unpacking, not rewritten");
                continue;
            }
            var rewritten = rewrite(call, oldParams, newParams);
            if (rewritten.isEmpty()) {
                warnings.add(where + ": a parameter is passed both by keyword and by position, not rewritten");
                continue;
            }
            var newText = rewritten.get();
            if (newText.equals(call.argumentText())) {
                continue;
            }
            // calls are visited outer first; a call nested in an accepted one is picked up on the next run
            if (call.argsStart() < acceptedEnd) {
                warnings.add(where + ": nested inside another rewritten call, not rewritten");
                continue;
            }
            int col = call.argsStart() - src.lineStart(call.line());
            edits.add(new Edit(
                    path,
                    call.line(),
                    col,
                    col + call.argumentText().length(),
                    call.argumentText(),
                    newText,
                    RenameEngine.context(src, call.line())));
            acceptedEnd = call.argsEnd();
        }
        return edits;
    }

    /**
     * The new parenthesized argument list, or empty when the call cannot be rewritten without passing some parameter
     * twice.
     */
    static Optional<String> rewrite(CallSite call, List<String> oldParams, List<ParamSpec> newParams) {
        var positional = call.positionalArgs();
        var values = new ArrayList<String>();
        var carried = new ArrayList<Boolean>();
        for (var spec : newParams) {
            int j = oldParams.indexOf(spec.name());
            if (j >= 0 && j < positional.size()) {
                values.add(positional.get(j));
                carried.add(true);
            } else {
                values.add(spec.defaultValue().orElse(MISSING_ARGUMENT));
                carried.add(false);
            }
        }
        // a trailing filler for a parameter the call already names by keyword is dropped
        while (!values.isEmpty()) {
            int last = values.size() - 1;
            if (carried.get(last) || !call.passesByKeyword(newParams.get(last).name())) {
                break;
            }
            values.remove(last);
            carried.remove(last);
        }
        for (int i = 0; i < values.size(); i++) {
            if (call.passesByKeyword(newParams.get(i).name())) {
                return Optional.empty();
            }
        }
        var args = new ArrayList<>(values);
        call.keywordArgs().forEach(k -> args.add(k.text()));
        return Optional.of("(" + String.join(", ", args) + ")");
    }
}
