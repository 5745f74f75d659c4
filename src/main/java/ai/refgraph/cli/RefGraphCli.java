package ai.refgraph.cli;

import ai.refgraph.EditBlock;
import ai.refgraph.IProject;
import ai.refgraph.Project;
import ai.refgraph.analyzer.OccurrenceKind;
import ai.refgraph.context.ChunkLoader;
import ai.refgraph.graph.CrossRefGraph;
import ai.refgraph.graph.GraphBuilder;
import ai.refgraph.graph.GraphQueries;
import ai.refgraph.graph.usages.UsageFinder;
import ai.refgraph.graph.usages.UsageHit;
import ai.refgraph.refactor.Edit;
import ai.refgraph.refactor.MigrationResult;
import ai.refgraph.refactor.MutationRequest;
import ai.refgraph.refactor.ParamSpec;
import ai.refgraph.refactor.RenameEngine;
import ai.refgraph.refactor.RenameResult;
import ai.refgraph.refactor.SignatureMigrator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "refgraph",
        mixinStandardHelpOptions = true,
        version = "refgraph 0.1.0",
        description = "Repository-wide symbol index, usage lookup, rename and signature migration.",
        subcommands = {
            RefGraphCli.IndexCommand.class,
            RefGraphCli.UsagesCommand.class,
            RefGraphCli.DefsCommand.class,
            RefGraphCli.SearchCommand.class,
            RefGraphCli.SummaryCommand.class,
            RefGraphCli.RenameCommand.class,
            RefGraphCli.SignatureCommand.class,
            RefGraphCli.ContextCommand.class,
            RefGraphCli.SliceCommand.class,
            RefGraphCli.PatchCommand.class
        })
public final class RefGraphCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(RefGraphCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    static final int ROOT_SEARCH_DEPTH = 8;
    static final Duration DECISION_TIMEOUT = Duration.ofMinutes(10);
    private static final String RULE = "=".repeat(60);

    @CommandLine.Option(
            names = "--root",
            description = "Project root. Defaults to the nearest ancestor holding .git or .refgraph.")
    @Nullable
    private Path root;

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    private final InputStream in;
    private final Path workingDir;
    private @Nullable IProject project;

    public RefGraphCli() {
        this(System.in, Path.of("").toAbsolutePath());
    }

    RefGraphCli(InputStream in, Path workingDir) {
        this.in = in;
        this.workingDir = workingDir;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new RefGraphCli()).execute(args);
        System.exit(exitCode);
    }

    /** A command line with the exception mapping every entry point shares. */
    static CommandLine commandLine(RefGraphCli cli) {
        var cmd = new CommandLine(cli);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                return EXIT_USAGE;
            }
            logger.error("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return EXIT_ERRORS;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        var cmd = spec == null ? new CommandLine(this) : spec.commandLine();
        cmd.usage(cmd.getErr());
        return EXIT_USAGE;
    }

    IProject project() {
        if (project == null) {
            var resolved = root != null ? root.toAbsolutePath().normalize() : discoverRoot(workingDir);
            if (!Files.isDirectory(resolved)) {
                throw new IllegalArgumentException("Project root is not a directory: " + resolved);
            }
            project = new Project(resolved);
        }
        return project;
    }

    /** The nearest directory at or above {@code start} containing {@code .git} or {@code .refgraph}. */
    static Path discoverRoot(Path start) {
        var dir = start.toAbsolutePath().normalize();
        for (int i = 0; i < ROOT_SEARCH_DEPTH && dir != null; i++) {
            if (Files.exists(dir.resolve(".git")) || Files.exists(dir.resolve(Project.REFGRAPH_DIR))) {
                return dir;
            }
            dir = dir.getParent();
        }
        return start.toAbsolutePath().normalize();
    }

    CrossRefGraph graph() {
        return new GraphBuilder(project()).loadOrBuild();
    }

    /** Approves {@code request} outright, or asks on stdin. */
    <P> void decide(MutationRequest<P> request, boolean assumeYes, PrintWriter out) {
        if (assumeYes) {
            request.approve();
            return;
        }
        out.print(request.description() + "? [y/N] ");
        out.flush();
        String answer;
        try {
            var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            answer = reader.readLine();
        } catch (IOException e) {
            logger.warn("Could not read confirmation: {}", e.getMessage());
            answer = null;
        }
        if (answer != null && List.of("y", "yes").contains(answer.strip().toLowerCase(Locale.ROOT))) {
            request.approve();
        } else {
            request.reject("declined at prompt");
        }
    }

    /** Brings a persisted graph up to date after files were rewritten. */
    void refreshGraph() {
        var builder = new GraphBuilder(project());
        if (Files.exists(builder.store().path())) {
            builder.build(true);
        }
    }

    static String truncate(String s, int limit) {
        return s.length() <= limit ? s : s.substring(0, limit);
    }

    abstract static class Subcommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        RefGraphCli parent;

        @CommandLine.Spec
        @Nullable
        CommandLine.Model.CommandSpec spec;

        RefGraphCli cli() {
            if (parent == null) {
                throw new IllegalStateException("Subcommand used outside refgraph");
            }
            return parent;
        }

        PrintWriter out() {
            if (spec == null) {
                throw new IllegalStateException("Subcommand used outside picocli");
            }
            return spec.commandLine().getOut();
        }

        PrintWriter err() {
            if (spec == null) {
                throw new IllegalStateException("Subcommand used outside picocli");
            }
            return spec.commandLine().getErr();
        }
    }

    @CommandLine.Command(name = "index", description = "Build the symbol graph and persist it.")
    static final class IndexCommand extends Subcommand {
        @CommandLine.Option(names = "--full", description = "Re-extract every file instead of reusing unchanged ones.")
        private boolean full;

        @CommandLine.Option(names = "--ignore", description = "Add a directory name to the saved ignore list.")
        private List<String> ignore = new ArrayList<>();

        @Override
        public Integer call() {
            var project = cli().project();
            if (!ignore.isEmpty() && project instanceof Project p) {
                ignore.forEach(p::addIgnoredDirectory);
            }
            var builder = new GraphBuilder(project);
            var graph = builder.build(!full);
            out().printf(
                    "Indexed %d file(s), %d symbol(s) -> %s%n",
                    graph.fileTable().size(),
                    graph.crossRefs().size(),
                    builder.store().path());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "usages", description = "Show every occurrence of a symbol.")
    static final class UsagesCommand extends Subcommand {
        static final int MAX_CALLS = 20;
        static final int MAX_OTHER = 10;
        static final int CONTEXT_WIDTH = 80;

        @CommandLine.Parameters(index = "0", paramLabel = "SYMBOL")
        private String symbol = "";

        @Override
        public Integer call() {
            var cli = cli();
            var hits = new UsageFinder(cli.project()).findUsages(symbol, cli.graph());
            var out = out();
            if (hits.isEmpty()) {
                out.printf("No usages found for '%s'%n", symbol);
                return EXIT_OK;
            }
            var defs = hits.stream().filter(h -> h.kind() == OccurrenceKind.DEFINITION).toList();
            var calls = hits.stream().filter(h -> h.kind() == OccurrenceKind.CALL).toList();
            var others = hits.stream()
                    .filter(h -> h.kind() != OccurrenceKind.DEFINITION && h.kind() != OccurrenceKind.CALL)
                    .toList();

            out.println(RULE);
            out.printf("  Usages of '%s' (%d total)%n", symbol, hits.size());
            out.println(RULE);
            section(out, "DEFINITIONS", defs, defs.size());
            section(out, "CALL SITES", calls, MAX_CALLS);
            section(out, "OTHER REFERENCES", others, MAX_OTHER);
            return EXIT_OK;
        }

        private static void section(PrintWriter out, String title, List<UsageHit> hits, int limit) {
            if (hits.isEmpty()) {
                return;
            }
            out.printf("%n%s (%d):%n", title, hits.size());
            hits.stream()
                    .limit(limit)
                    .forEach(h -> out.printf(
                            "  %s:%d  %s%n", h.file(), h.line(), truncate(h.context(), CONTEXT_WIDTH)));
        }
    }

    @CommandLine.Command(name = "defs", description = "Show where a symbol is defined.")
    static final class DefsCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "SYMBOL")
        private String symbol = "";

        @Override
        public Integer call() {
            var definitions = GraphQueries.definitions(cli().graph(), symbol);
            if (definitions.isEmpty()) {
                out().printf("No definitions found for '%s'%n", symbol);
            }
            definitions.forEach(d -> out().printf("%s:%d%n", d.file(), d.line()));
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "search", description = "List indexed names starting with a prefix, ignoring case.")
    static final class SearchCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PREFIX")
        private String prefix = "";

        @Override
        public Integer call() {
            GraphQueries.prefixSearch(cli().graph(), prefix).forEach(out()::println);
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "summary", description = "One-line summary of the declarations in a file.")
    static final class SummaryCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Path relative to the root.")
        private String file = "";

        @Override
        public Integer call() {
            out().printf("%s: %s%n", file, GraphQueries.fileSummary(cli().graph(), file.replace('\\', '/')));
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "rename", description = "Rename an identifier across the project.")
    static final class RenameCommand extends Subcommand {
        static final int SITES_PER_FILE = 5;
        static final int CONTEXT_WIDTH = 70;

        @CommandLine.Parameters(index = "0", paramLabel = "OLD")
        private String oldName = "";

        @CommandLine.Parameters(index = "1", paramLabel = "NEW")
        private String newName = "";

        @CommandLine.Option(names = "--apply", description = "Write the changes. Without it nothing is written.")
        private boolean apply;

        @CommandLine.Option(names = "--yes", description = "Do not ask for confirmation before writing.")
        private boolean yes;

        @Override
        public Integer call() throws InterruptedException {
            var cli = cli();
            var engine = new RenameEngine(cli.project());
            var preview = engine.rename(oldName, newName, true);
            var out = out();
            if (!apply || preview.edits().isEmpty() || !preview.errors().isEmpty()) {
                print(out, preview, "DRY RUN (pass --apply to write)");
                return preview.errors().isEmpty() ? EXIT_OK : EXIT_ERRORS;
            }

            if (!yes) {
                print(out, preview, "PREVIEW");
            }
            var request = new MutationRequest<>(
                    "Rename '%s' to '%s' in %d file(s)"
                            .formatted(oldName, newName, preview.filesAffected().size()),
                    preview);
            return applyApproved(cli, request, () -> engine.rename(oldName, newName, false), out);
        }

        private int applyApproved(
                RefGraphCli cli,
                MutationRequest<RenameResult> request,
                Supplier<RenameResult> applier,
                PrintWriter out)
                throws InterruptedException {
            cli.decide(request, yes, out);
            var result = request.execute(DECISION_TIMEOUT, applier);
            if (result.isEmpty()) {
                out.println("No changes written.");
                return EXIT_OK;
            }
            print(out, result.get(), result.get().applied() ? "APPLIED" : "FAILED");
            cli.refreshGraph();
            return result.get().errors().isEmpty() ? EXIT_OK : EXIT_ERRORS;
        }

        static void print(PrintWriter out, RenameResult result, String mode) {
            var files = result.filesAffected();
            out.println(RULE);
            out.printf("  Rename: '%s' -> '%s'%n", result.oldName(), result.newName());
            out.printf("  Mode:   %s%n", mode);
            out.println(RULE);
            out.printf("%n%d edit(s) across %d file(s):%n%n", result.edits().size(), files.size());
            for (var file : files) {
                var edits = result.edits().stream().filter(e -> e.file().equals(file)).toList();
                out.printf("  %s  (%d sites)%n", file, edits.size());
                for (Edit e : edits.subList(0, Math.min(edits.size(), SITES_PER_FILE))) {
                    out.printf("    L%d: %s%n", e.line(), truncate(e.context(), CONTEXT_WIDTH));
                }
            }
            if (!result.errors().isEmpty()) {
                out.printf("%nERRORS:%n");
                result.errors().forEach(err -> out.println("  " + err));
            }
            out.flush();
        }
    }

    @CommandLine.Command(name = "signature", description = "Rewrite call sites after a function's parameters change.")
    static final class SignatureCommand extends Subcommand {
        static final int MAX_SITES = 20;
        static final int TEXT_WIDTH = 80;

        @CommandLine.Parameters(index = "0", paramLabel = "FUNCTION")
        private String function = "";

        @CommandLine.Parameters(
                index = "1..*",
                arity = "1..*",
                paramLabel = "PARAMS",
                description = "New parameter list, e.g. \"name, loud=False\".")
        private List<String> params = new ArrayList<>();

        @CommandLine.Option(names = "--apply", description = "Write the changes. Without it nothing is written.")
        private boolean apply;

        @CommandLine.Option(names = "--yes", description = "Do not ask for confirmation before writing.")
        private boolean yes;

        @Override
        public Integer call() throws InterruptedException {
            var cli = cli();
            var specs = ParamSpec.parseList(String.join(", ", params));
            var migrator = new SignatureMigrator(cli.project());
            var preview = migrator.migrate(function, specs, true);
            var out = out();
            if (!apply || preview.edits().isEmpty() || !preview.errors().isEmpty()) {
                print(out, preview, "DRY RUN (pass --apply to write)");
                return preview.errors().isEmpty() ? EXIT_OK : EXIT_ERRORS;
            }

            if (!yes) {
                print(out, preview, "PREVIEW");
            }
            var request = new MutationRequest<>(
                    "Rewrite %d call site(s) of '%s'".formatted(preview.edits().size(), function), preview);
            cli.decide(request, yes, out);
            var result = request.execute(DECISION_TIMEOUT, () -> migrator.migrate(function, specs, false));
            if (result.isEmpty()) {
                out.println("No changes written.");
                return EXIT_OK;
            }
            print(out, result.get(), result.get().applied() ? "APPLIED" : "FAILED");
            cli.refreshGraph();
            return result.get().errors().isEmpty() ? EXIT_OK : EXIT_ERRORS;
        }

        static void print(PrintWriter out, MigrationResult result, String mode) {
            out.println(RULE);
            out.printf(
                    "  Signature migration: %s(%s)%n", result.functionName(), String.join(", ", result.newParams()));
            out.printf("  Mode: %s%n", mode);
            out.println(RULE);
            if (!result.errors().isEmpty() && result.oldParams().isEmpty() && result.edits().isEmpty()) {
                result.errors().forEach(e -> out.println("  ERROR: " + e));
                out.flush();
                return;
            }
            out.printf("%n%d call site(s) found:%n%n", result.edits().size());
            for (var edit : result.edits().subList(0, Math.min(result.edits().size(), MAX_SITES))) {
                out.printf("  %s:%d%n", edit.file(), edit.line());
                out.printf("    before: %s%n", truncate(edit.oldText(), TEXT_WIDTH));
                out.printf("    after:  %s%n", truncate(edit.newText(), TEXT_WIDTH));
            }
            if (!result.warnings().isEmpty()) {
                out.printf("%nWARNINGS:%n");
                result.warnings().forEach(w -> out.println("  " + w));
            }
            if (!result.errors().isEmpty()) {
                out.printf("%nERRORS:%n");
                result.errors().forEach(e -> out.println("  " + e));
            }
            out.flush();
        }
    }

    @CommandLine.Command(name = "context", description = "Print the code most relevant to a free-text query.")
    static final class ContextCommand extends Subcommand {
        @CommandLine.Parameters(arity = "1..*", paramLabel = "QUERY")
        private List<String> query = new ArrayList<>();

        @CommandLine.Option(names = "--max-chars", description = "Character budget; defaults to contextMaxChars.")
        @Nullable
        private Integer maxChars;

        @Override
        public Integer call() {
            var cli = cli();
            var project = cli.project();
            int budget = maxChars != null ? maxChars : project.getContextMaxChars();
            if (budget <= 0) {
                throw new IllegalArgumentException("--max-chars must be positive, got " + budget);
            }
            var text = String.join(" ", query);
            var chunks = new ChunkLoader(project).relevantChunks(text, cli.graph(), budget);
            if (chunks.isEmpty()) {
                out().printf("No relevant code found for '%s'%n", text);
                return EXIT_OK;
            }
            out().println(ChunkLoader.renderContext(chunks));
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "slice", description = "Print a definition with surrounding lines.")
    static final class SliceCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "SYMBOL")
        private String symbol = "";

        @CommandLine.Option(names = "--context", defaultValue = "5", description = "Lines shown on either side.")
        private int contextLines;

        @Override
        public Integer call() {
            if (contextLines < 0) {
                throw new IllegalArgumentException("--context must not be negative, got " + contextLines);
            }
            var slice = new ChunkLoader(cli().project()).functionSlice(symbol, contextLines);
            if (slice.isEmpty()) {
                err().printf("Definition of '%s' not found%n", symbol);
                return EXIT_ERRORS;
            }
            var s = slice.get();
            out().printf(
                    "# %s (L%d-%d, definition L%d-%d)%n",
                    s.file(), s.sliceStart(), s.sliceEnd(), s.startLine(), s.endLine());
            out().println(s.code());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "patch", description = "Replace the first exact occurrence of a text in a file.")
    static final class PatchCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Path relative to the root.")
        private String file = "";

        @CommandLine.Option(names = "--search-file", required = true, description = "File holding the text to find.")
        @Nullable
        private Path searchFile;

        @CommandLine.Option(
                names = "--replace-file",
                required = true,
                description = "File holding the replacement text.")
        @Nullable
        private Path replaceFile;

        @Override
        public Integer call() throws IOException {
            if (searchFile == null || replaceFile == null) {
                throw new IllegalArgumentException("--search-file and --replace-file are required");
            }
            var search = Files.readString(searchFile);
            var replace = Files.readString(replaceFile);
            var target = cli().project().toFile(file);
            var result = EditBlock.applyToFile(target, search, replace);
            if (result instanceof EditBlock.PatchResult.NoMatch) {
                err().printf("Search text not found in %s%n", target);
                return EXIT_ERRORS;
            }
            var verb = result instanceof EditBlock.PatchResult.Appended ? "Appended to" : "Patched";
            out().printf("%s %s%n", verb, target);
            cli().refreshGraph();
            return EXIT_OK;
        }
    }
}
