package tyrepl.lexer;

import tyrepl.TyReplException;

public class LexerException extends TyReplException {

    private final char character;
    private final int offset;

    public LexerException(char character, int offset, String message) {
        super(Kind.LEXICAL, "[" + offset + "] " + message);
        this.character = character;
        this.offset = offset;
    }

    /** The character the lexer stopped at. */
    public char character() {
        return character;
    }

    public int offset() {
        return offset;
    }
}
