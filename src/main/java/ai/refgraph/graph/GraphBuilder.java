package ai.refgraph.graph;

import ai.refgraph.IProject;
import ai.refgraph.analyzer.FileSymbolTable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the cross-reference graph for a project. Declaration tables are cached per file by content hash; occurrences
 * are re-scanned on every build, and the name index is assembled from scratch so removed names never linger.
 *
 * <p>One builder per root. Not thread-safe.
 */
public class GraphBuilder {
    private static final Logger logger = LogManager.getLogger(GraphBuilder.class);

    private final IProject project;
    private final GraphStore store;

    public GraphBuilder(IProject project) {
        this.project = project;
        this.store = new GraphStore(project);
    }

    public GraphStore store() {
        return store;
    }

    /** The persisted graph, or an empty one. Never parses sources. */
    public CrossRefGraph load() {
        return store.load();
    }

    /** The persisted graph if it covers any files, otherwise a fresh incremental build. */
    public CrossRefGraph loadOrBuild() {
        var graph = load();
        return graph.isEmpty() ? build(true) : graph;
    }

    /**
     * Scans every source file and returns the new graph, which is also persisted. A persistence failure is logged and
     * does not fail the build.
     *
     * @param incremental reuse the stored declaration table of any file whose hash is unchanged
     */
    public CrossRefGraph build(boolean incremental) {
        long started = System.currentTimeMillis();
        var previous = incremental ? store.load() : CrossRefGraph.empty();
        var builder = new CrossRefGraph.Builder(project.getMinSymbolLength());
        int reindexed = 0;

        var files = project.getSourceFiles();
        for (var file : files) {
            byte[] bytes;
            try {
                bytes = file.readBytes();
            } catch (IOException e) {
                logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            var key = file.toString();
            var hash = md5Hex(bytes);
            var source = new String(bytes, StandardCharsets.UTF_8);
            var parser = file.getLanguage().getParser();

            FileSymbolTable table = previous.fileTable().get(key);
            if (!incremental || table == null || !hash.equals(previous.fileHash().get(key))) {
                table = parser.extract(file, source);
                reindexed++;
            }
            builder.addFile(key, hash, table, parser.occurrences(file, source));
        }

        var graph = builder.build();
        try {
            store.save(graph);
        } catch (IOException e) {
            logger.warn("Could not persist symbol graph to {}: {}", store.path(), e.getMessage());
        }
        logger.info(
                "Symbol graph ready: {} files, {} symbols ({} re-indexed, {} ms)",
                graph.fileTable().size(),
                graph.crossRefs().size(),
                reindexed,
                System.currentTimeMillis() - started);
        return graph;
    }

    static String md5Hex(byte[] bytes) {
        try {
            var digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
