package ai.callflow.scan;

/**
 * The source could not be turned into a syntax tree.
 */
public class SourceParseException extends Exception {

    private final int problemCount;

    public SourceParseException(String message, int problemCount) {
        super(message);
        this.problemCount = problemCount;
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
        this.problemCount = 0;
    }

    public int problemCount() {
        return problemCount;
    }
}
