package tyrepl;

/**
 * Base of every failure the inference pipeline can raise for one input line.
 * A failure aborts the line; the shell decides whether to keep reading.
 */
public abstract class TyReplException extends RuntimeException {

    public enum Kind {
        LEXICAL("Lexical"),
        SYNTAX("Syntax"),
        UNIFICATION("Unification");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;

    protected TyReplException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /** Single line suitable for the console, e.g. {@code Syntax error: [4] Expected ')'}. */
    public String diagnostic() {
        return kind.label() + " error: " + getMessage();
    }
}
