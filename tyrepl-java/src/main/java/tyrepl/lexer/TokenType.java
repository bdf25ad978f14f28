package tyrepl.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    BOOL_LITERAL,

    // keywords
    IF,
    THEN,
    ELSE,
    LET,
    IN,

    // operators
    PLUS, MINUS, STAR, SLASH,
    LT,
    AND, OR, NOT,
    ASSIGN,

    // symbols
    LPAREN, RPAREN,

    EOF
}
