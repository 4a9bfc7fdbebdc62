package ai.codegraft;

/** Thrown when source text is not syntactically valid Python. */
public final class ParseFailureException extends GraftException {
    private final int line;

    public ParseFailureException(String message, int line) {
        super(FailureKind.PARSE_FAILURE, message, null);
        this.line = line;
    }

    public ParseFailureException(FailureKind kind, String message, int line) {
        super(kind, message, null);
        this.line = line;
    }

    /** 1-based line of the first syntax error, or 0 when unknown. */
    public int line() {
        return line;
    }
}
