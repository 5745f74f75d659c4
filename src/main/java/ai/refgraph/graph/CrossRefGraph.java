package ai.refgraph.graph;

import ai.refgraph.analyzer.FileSymbolTable;
import ai.refgraph.analyzer.SymbolOccurrence;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of the project's symbols: per-file content hashes and declaration tables, plus every occurrence of every
 * name keyed by the name. Immutable; all maps are sorted by key so that the serialized form is stable.
 */
public record CrossRefGraph(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("fileHash") Map<String, String> fileHash,
        @JsonProperty("fileTable") Map<String, FileSymbolTable> fileTable,
        @JsonProperty("crossRefs") Map<String, List<SymbolOccurrence>> crossRefs) {

    public static final int SCHEMA_VERSION = 5;

    public CrossRefGraph {
        fileHash = sorted(fileHash);
        fileTable = sorted(fileTable);
        var refs = new TreeMap<String, List<SymbolOccurrence>>();
        if (crossRefs != null) {
            crossRefs.forEach((name, occurrences) -> refs.put(name, List.copyOf(occurrences)));
        }
        crossRefs = Collections.unmodifiableMap(refs);
    }

    public static CrossRefGraph empty() {
        return new CrossRefGraph(SCHEMA_VERSION, Map.of(), Map.of(), Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fileTable.isEmpty();
    }

    /** Every occurrence of {@code name}, exact and case-sensitive; empty when unknown. */
    public List<SymbolOccurrence> occurrencesOf(String name) {
        return crossRefs.getOrDefault(name, List.of());
    }

    private static <V> Map<String, V> sorted(@Nullable Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(map));
    }

    /** Collects occurrences in file order and produces the immutable graph. */
    static final class Builder {
        private final Map<String, String> fileHash = new TreeMap<>();
        private final Map<String, FileSymbolTable> fileTable = new TreeMap<>();
        private final Map<String, List<SymbolOccurrence>> crossRefs = new TreeMap<>();
        private final int minSymbolLength;

        Builder(int minSymbolLength) {
            this.minSymbolLength = minSymbolLength;
        }

        void addFile(String file, String hash, FileSymbolTable table, List<SymbolOccurrence> occurrences) {
            fileHash.put(file, hash);
            fileTable.put(file, table);
            for (var occurrence : occurrences) {
                if (occurrence.name().length() < minSymbolLength) {
                    continue;
                }
                crossRefs.computeIfAbsent(occurrence.name(), k -> new ArrayList<>()).add(occurrence);
            }
        }

        CrossRefGraph build() {
            return new CrossRefGraph(SCHEMA_VERSION, fileHash, fileTable, crossRefs);
        }
    }
}
