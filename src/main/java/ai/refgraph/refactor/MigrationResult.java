package ai.refgraph.refactor;

import java.util.List;

/**
 * Outcome of a signature migration.
 *
 * @param oldParams positional parameters of the definition that was found; empty when none was
 * @param warnings call sites left untouched because rewriting them could change their meaning
 */
public record MigrationResult(
        String functionName,
        List<String> oldParams,
        List<String> newParams,
        List<Edit> edits,
        List<String> errors,
        List<String> warnings,
        boolean applied) {

    public MigrationResult {
        oldParams = List.copyOf(oldParams);
        newParams = List.copyOf(newParams);
        edits = List.copyOf(edits);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
