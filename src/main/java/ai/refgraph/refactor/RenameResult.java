package ai.refgraph.refactor;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of a rename. {@code applied} is true only for a non-dry run that recorded no errors.
 *
 * @param errors one {@code "<file>: <message>"} entry per file that could not be written
 */
public record RenameResult(String oldName, String newName, List<Edit> edits, List<String> errors, boolean applied) {
    public RenameResult {
        edits = List.copyOf(edits);
        errors = List.copyOf(errors);
    }

    public Set<String> filesAffected() {
        var files = new TreeSet<String>();
        edits.forEach(e -> files.add(e.file()));
        return files;
    }
}
