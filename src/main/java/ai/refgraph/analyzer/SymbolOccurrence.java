package ai.refgraph.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One use (or the declaration) of a name in a file.
 *
 * @param file project-relative path with forward slashes
 * @param line 1-based line number
 */
public record SymbolOccurrence(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("kind") OccurrenceKind kind,
        @JsonProperty("name") String name) {

    @JsonIgnore
    public boolean isDefinition() {
        return kind == OccurrenceKind.DEFINITION;
    }
}
