package ai.refgraph.graph.usages;

import ai.refgraph.IProject;
import ai.refgraph.analyzer.SourceText;
import ai.refgraph.graph.CrossRefGraph;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Finds usage sites of a name and attaches the text of each site's line. */
public class UsageFinder {
    private static final Logger logger = LogManager.getLogger(UsageFinder.class);

    public static final int CONTEXT_LIMIT = 120;

    private final IProject project;

    public UsageFinder(IProject project) {
        this.project = project;
    }

    /**
     * Every occurrence of {@code symbol}, definitions included. With a graph the index is used and only the referenced
     * files are read; without one, every source file mentioning the name is parsed.
     */
    public List<UsageHit> findUsages(String symbol, @Nullable CrossRefGraph graph) {
        return graph == null ? scan(symbol) : fromGraph(symbol, graph);
    }

    private List<UsageHit> fromGraph(String symbol, CrossRefGraph graph) {
        var sources = new HashMap<String, SourceText>();
        var hits = new ArrayList<UsageHit>();
        for (var occurrence : graph.occurrencesOf(symbol)) {
            var source = sources.computeIfAbsent(occurrence.file(), this::readQuietly);
            hits.add(new UsageHit(
                    occurrence.file(), occurrence.line(), occurrence.kind(), context(source, occurrence.line())));
        }
        return hits;
    }

    private List<UsageHit> scan(String symbol) {
        var hits = new ArrayList<UsageHit>();
        for (var file : project.getSourceFiles()) {
            String text;
            try {
                text = file.read();
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            if (!text.contains(symbol)) {
                continue;
            }
            var source = new SourceText(text);
            for (var occurrence : file.getLanguage().getParser().occurrences(file, text)) {
                if (occurrence.name().equals(symbol)) {
                    hits.add(new UsageHit(
                            occurrence.file(), occurrence.line(), occurrence.kind(), context(source, occurrence.line())));
                }
            }
        }
        return hits;
    }

    private SourceText readQuietly(String relPath) {
        try {
            return new SourceText(project.toFile(relPath).read());
        } catch (IOException e) {
            logger.debug("Cannot read {} for usage context: {}", relPath, e.getMessage());
            return new SourceText("");
        }
    }

    static String context(SourceText source, int line) {
        var text = source.line(line).strip();
        return text.length() <= CONTEXT_LIMIT ? text : text.substring(0, CONTEXT_LIMIT);
    }
}
