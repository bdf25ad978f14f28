package tyrepl.parser;

import tyrepl.TyReplException;
import tyrepl.lexer.Token;

public class ParserException extends TyReplException {

    private final int offset;

    public ParserException(Token at, String expected) {
        super(Kind.SYNTAX, "[" + at.offset() + "] " + expected + describe(at));
        this.offset = at.offset();
    }

    public int offset() {
        return offset;
    }

    private static String describe(Token at) {
        return switch (at.type()) {
            case EOF -> " (got end of input)";
            default -> " (got " + at.type() + " '" + at.lexeme() + "')";
        };
    }
}
