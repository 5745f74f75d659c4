package ai.refgraph.graph;

import ai.refgraph.IProject;
import ai.refgraph.util.AtomicWrites;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads and writes the graph document at {@code <root>/.refgraph/symbol_graph.json}. */
public final class GraphStore {
    private static final Logger logger = LogManager.getLogger(GraphStore.class);

    public static final String GRAPH_FILE = "symbol_graph.json";

    static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path graphPath;

    public GraphStore(IProject project) {
        this.graphPath = project.getMetadataDir().resolve(GRAPH_FILE);
    }

    public Path path() {
        return graphPath;
    }

    /**
     * The persisted graph, or an empty one when the document is missing, unreadable or written under a different
     * schema version.
     */
    public CrossRefGraph load() {
        if (!Files.exists(graphPath)) {
            return CrossRefGraph.empty();
        }
        try {
            var tree = objectMapper.readTree(graphPath.toFile());
            var version = tree.path("schemaVersion").asInt(-1);
            if (version != CrossRefGraph.SCHEMA_VERSION) {
                logger.info(
                        "Ignoring graph at {}: schema version {} (expected {})",
                        graphPath,
                        version,
                        CrossRefGraph.SCHEMA_VERSION);
                return CrossRefGraph.empty();
            }
            return objectMapper.treeToValue(tree, CrossRefGraph.class);
        } catch (IOException e) {
            logger.warn("Could not read graph from {}: {}", graphPath, e.getMessage());
            return CrossRefGraph.empty();
        }
    }

    public void save(CrossRefGraph graph) throws IOException {
        AtomicWrites.atomicOverwrite(graphPath, serialize(graph));
    }

    /** The exact bytes {@link #save} writes. */
    public static String serialize(CrossRefGraph graph) throws IOException {
        return objectMapper.writeValueAsString(graph) + "\n";
    }
}
