package tyrepl.lexer;

import com.google.common.flogger.FluentLogger;

import java.util.*;

public class Lexer {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("let", TokenType.LET),
            Map.entry("in", TokenType.IN),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int start = pos;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '(' -> add(TokenType.LPAREN, "(", start);
                case ')' -> add(TokenType.RPAREN, ")", start);
                case '+' -> add(TokenType.PLUS, "+", start);
                case '*' -> add(TokenType.STAR, "*", start);
                case '/' -> add(TokenType.SLASH, "/", start);
                case '<' -> add(TokenType.LT, "<", start);
                case '=' -> add(TokenType.ASSIGN, "=", start);
                case '!' -> add(TokenType.NOT, "!", start);

                case '-' -> {
                    // "-1" is a literal, "- 1" is the operator followed by a literal
                    if (isDigit(peek())) numberLiteral(start);
                    else add(TokenType.MINUS, "-", start);
                }

                case '&' -> {
                    if (match('&')) add(TokenType.AND, "&&", start);
                    else error(c, start, "Unexpected '&'");
                }

                case '|' -> {
                    if (match('|')) add(TokenType.OR, "||", start);
                    else error(c, start, "Unexpected '|'");
                }

                default -> {
                    if (isDigit(c)) numberLiteral(start);
                    else if (isAlpha(c)) word(start);
                    else error(c, start, "Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        logger.atFine().log("lexed %d tokens from %d characters", tokens.size() - 1, source.length());
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        String text = source.substring(start, pos);
        try {
            Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new LexerException(source.charAt(start), start, "Integer literal out of range: " + text);
        }
        add(TokenType.INT_LITERAL, text, start);
    }

    private void word(int start) {
        while (!isAtEnd() && isAlpha(peek())) {
            advance();
        }

        String text = source.substring(start, pos);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        return source.charAt(pos++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private void add(TokenType type, String lexeme, int offset) {
        tokens.add(new Token(type, lexeme, offset));
    }

    private void error(char c, int offset, String message) {
        throw new LexerException(c, offset, message);
    }
}
