package ai.refgraph.context;

import ai.refgraph.IProject;
import ai.refgraph.analyzer.ParserCapability;
import ai.refgraph.analyzer.ProjectFile;
import ai.refgraph.analyzer.SourceText;
import ai.refgraph.graph.CrossRefGraph;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Picks the code most relevant to a free-text query without loading whole files. Candidate files come from the
 * cross-reference graph when one is available; every candidate is cut into chunks, each chunk is scored by token
 * overlap with the query, and the best chunks are kept until the character budget runs out.
 *
 * <p>The first chunk is always kept, even if it alone exceeds the budget, so a query with any match yields at least
 * one result.
 */
public class ChunkLoader {
    private static final Logger logger = LogManager.getLogger(ChunkLoader.class);

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    static final double EXACT_NAME_BONUS = 3.0;
    static final int SCORED_SOURCE_PREFIX = 400;
    static final int EXACT_REFS_PER_TOKEN = 5;
    static final int PREFIX_REFS_PER_SYMBOL = 2;
    static final int MAX_CANDIDATE_FILES = 20;
    static final int RENDERED_SOURCE_LIMIT = 500;
    static final int FALLBACK_LINES_BEFORE = 3;
    static final int FALLBACK_LINES_AFTER = 20;

    private final IProject project;

    public ChunkLoader(IProject project) {
        this.project = project;
    }

    /** Lines around a definition, as returned by {@link #functionSlice}. */
    public record FunctionSlice(String file, int startLine, int endLine, int sliceStart, int sliceEnd, String code) {}

    public List<Chunk> relevantChunks(String query, @Nullable CrossRefGraph graph) {
        return relevantChunks(query, graph, project.getContextMaxChars());
    }

    /**
     * @return chunks in descending relevance whose combined source fits {@code maxChars}, except that the first chunk
     *     is kept regardless of its size
     */
    public List<Chunk> relevantChunks(String query, @Nullable CrossRefGraph graph, int maxChars) {
        var queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        var scored = new ArrayList<Chunk>();
        for (var file : candidateFiles(queryTokens, graph)) {
            String source;
            try {
                source = file.read();
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            for (var block : file.getLanguage().getParser().blocks(file, source)) {
                var chunk = Chunk.of(file.toString(), block);
                scored.add(chunk.withScore(score(chunk, queryTokens)));
            }
        }

        // List.sort is stable, so equal scores keep file and declaration order
        var ranked = scored.stream()
                .filter(c -> c.relevanceScore() > 0)
                .sorted(Comparator.comparingDouble(Chunk::relevanceScore).reversed())
                .toList();
        var result = selectWithinBudget(ranked, maxChars);
        logger.debug("Query '{}': {} scored chunk(s), {} selected", query, ranked.size(), result.size());
        return result;
    }

    private List<ProjectFile> candidateFiles(List<String> queryTokens, @Nullable CrossRefGraph graph) {
        var names = new LinkedHashSet<String>();
        if (graph != null) {
            var crossRefs = graph.crossRefs();
            for (var token : queryTokens) {
                crossRefs.getOrDefault(token, List.of()).stream()
                        .limit(EXACT_REFS_PER_TOKEN)
                        .forEach(o -> names.add(o.file()));
                crossRefs.forEach((symbol, occurrences) -> {
                    if (symbol.toLowerCase(Locale.ROOT).startsWith(token)) {
                        occurrences.stream().limit(PREFIX_REFS_PER_SYMBOL).forEach(o -> names.add(o.file()));
                    }
                });
            }
        }

        List<ProjectFile> files;
        if (names.isEmpty()) {
            files = project.getSourceFiles().stream()
                    .filter(f -> f.getLanguage().capability() == ParserCapability.EXACT_GRAMMAR)
                    .toList();
        } else {
            files = names.stream().map(project::toFile).filter(ProjectFile::exists).toList();
        }
        return files.size() > MAX_CANDIDATE_FILES ? files.subList(0, MAX_CANDIDATE_FILES) : files;
    }

    /** Lower-cased identifier-like words longer than one character, in order of appearance. */
    public static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        var m = TOKEN.matcher(text);
        while (m.find()) {
            if (m.group().length() > 1) {
                tokens.add(m.group().toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    /**
     * Fraction of distinct query tokens found in the chunk's name, doc and source prefix, plus a bonus when the
     * chunk's name is itself one of the query tokens.
     */
    public static double score(Chunk chunk, List<String> queryTokens) {
        var source = chunk.sourceText();
        var text = chunk.symbol() + " " + chunk.doc() + " "
                + source.substring(0, Math.min(source.length(), SCORED_SOURCE_PREFIX));
        var chunkTokens = new HashSet<>(tokenize(text));
        if (chunkTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> querySet = new HashSet<>(queryTokens);
        long overlap = querySet.stream().filter(chunkTokens::contains).count();
        double bonus = querySet.contains(chunk.symbol().toLowerCase(Locale.ROOT)) ? EXACT_NAME_BONUS : 0.0;
        return (double) overlap / Math.max(querySet.size(), 1) + bonus;
    }

    static List<Chunk> selectWithinBudget(List<Chunk> ranked, int maxChars) {
        var result = new ArrayList<Chunk>();
        int total = 0;
        for (var chunk : ranked) {
            if (total + chunk.size() > maxChars && !result.isEmpty()) {
                break;
            }
            result.add(chunk);
            total += chunk.size();
        }
        return result;
    }

    /**
     * Source of the function or class named {@code symbol} in {@code file}, decorators included. When the parser
     * finds no such definition, a window of lines around the first line mentioning the name is returned instead;
     * empty when the name does not appear or the file cannot be read.
     */
    public String loadSymbolChunk(ProjectFile file, String symbol) {
        String source;
        try {
            source = file.read();
        } catch (IOException e) {
            logger.debug("Cannot read {}: {}", file, e.getMessage());
            return "";
        }
        var definition = file.getLanguage().getParser().findDefinition(source, symbol);
        if (definition.isPresent()) {
            return definition.get().text();
        }
        var src = new SourceText(source);
        for (int line = 1; line <= src.lineCount(); line++) {
            if (src.line(line).contains(symbol)) {
                int from = Math.max(1, line - FALLBACK_LINES_BEFORE);
                int to = Math.min(src.lineCount(), line + FALLBACK_LINES_AFTER - 1);
                return src.lines(from, to);
            }
        }
        return "";
    }

    /**
     * The first definition of {@code symbol} across the project's files, in path order, with up to
     * {@code contextLines} lines on either side.
     */
    public Optional<FunctionSlice> functionSlice(String symbol, int contextLines) {
        for (var file : project.getSourceFiles()) {
            String source;
            try {
                source = file.read();
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            if (!source.contains(symbol)) {
                continue;
            }
            var definition = file.getLanguage().getParser().findDefinition(source, symbol);
            if (definition.isEmpty()) {
                continue;
            }
            var src = new SourceText(source);
            var block = definition.get();
            int sliceStart = Math.max(1, block.startLine() - contextLines);
            int sliceEnd = Math.min(src.lineCount(), block.endLine() + contextLines);
            var code = src.lines(sliceStart, sliceEnd).stripTrailing();
            return Optional.of(
                    new FunctionSlice(file.toString(), block.startLine(), block.endLine(), sliceStart, sliceEnd, code));
        }
        return Optional.empty();
    }

    /** The prompt bundle for a set of chunks; empty when there are none. */
    public static String renderContext(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return "";
        }
        var parts = new ArrayList<String>();
        parts.add("[RELEVANT CODE CHUNKS]");
        for (var chunk : chunks) {
            parts.add("\n# %s::%s (L%d-%d)"
                    .formatted(chunk.file(), chunk.symbol(), chunk.startLine(), chunk.endLine()));
            var source = chunk.sourceText();
            parts.add(source.substring(0, Math.min(source.length(), RENDERED_SOURCE_LIMIT)));
        }
        parts.add("[/RELEVANT CODE CHUNKS]");
        return String.join("\n", parts);
    }
}
