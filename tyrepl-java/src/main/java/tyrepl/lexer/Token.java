package tyrepl.lexer;

/**
 * One lexeme of an input line. {@code offset} is the zero-based index of its first character.
 */
public record Token(TokenType type, String lexeme, int offset) {

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + offset;
    }
}
