package ai.refgraph.refactor;

/** The file no longer contains an edit's {@code oldText} where the edit expects it. */
public class StaleEditException extends Exception {
    public StaleEditException(String message) {
        super(message);
    }
}
