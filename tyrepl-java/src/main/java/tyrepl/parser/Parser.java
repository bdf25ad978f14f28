package tyrepl.parser;

import com.google.common.flogger.FluentLogger;
import tyrepl.ast.*;
import tyrepl.lexer.Token;
import tyrepl.lexer.TokenType;

import java.util.List;

/**
 * LL(1) parser for the parenthesised expression grammar:
 *
 * <pre>
 * expr := IDENTIFIER | INT_LITERAL | BOOL_LITERAL | '(' form
 * form := ('+' | '-' | '*' | '/' | '&lt;' | '&amp;&amp;' | '||') expr expr ')'
 *       | '!' expr ')'
 *       | 'if' expr 'then' expr 'else' expr ')'
 *       | 'let' expr '=' expr 'in' expr ')'      -- first expr must be a variable
 * </pre>
 *
 * The first error aborts the parse with a {@link ParserException}.
 */
public final class Parser {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /** Deepest allowed nesting of parenthesised forms; every later pass recurses this deep. */
    public static final int MAX_DEPTH = 500;

    private final List<Token> tokens;
    private int pos = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Expr parse() {
        if (check(TokenType.EOF)) throw error(peek(), "Empty expression");
        Expr root = parseExpr();
        consume(TokenType.EOF, "Expected end of input after expression");
        logger.atFine().log("parsed %s", root.getClass().getSimpleName());
        return root;
    }

    // ---------- expressions ----------
    private Expr parseExpr() {
        if (match(TokenType.IDENTIFIER)) return new VarExpr(previous().lexeme());
        if (match(TokenType.INT_LITERAL)) return new IntLiteral(Integer.parseInt(previous().lexeme()));
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("true".equals(previous().lexeme()));
        if (match(TokenType.LPAREN)) return parseForm();
        throw error(peek(), "Expected expression");
    }

    private Expr parseForm() {
        Token head = peek();
        if (++depth > MAX_DEPTH) {
            throw error(head, "Expression nested too deeply (limit " + MAX_DEPTH + ")");
        }
        advance();
        Expr form = switch (head.type()) {
            case PLUS, MINUS, STAR, SLASH, LT, AND, OR -> {
                Expr left = parseExpr();
                Expr right = parseExpr();
                yield new BinaryExpr(left, toBinOp(head.type()), right);
            }
            case NOT -> new UnaryExpr(UnaryExpr.Operator.NOT, parseExpr());
            case IF -> parseIf();
            case LET -> parseLet();
            default -> throw error(head, "Expected operator, 'if' or 'let' after '('");
        };
        consume(TokenType.RPAREN, "Expected ')'");
        depth--;
        return form;
    }

    private IfExpr parseIf() {
        Expr cond = parseExpr();
        consume(TokenType.THEN, "Expected 'then'");
        Expr thenB = parseExpr();
        consume(TokenType.ELSE, "Expected 'else'");
        Expr elseB = parseExpr();
        return new IfExpr(cond, thenB, elseB);
    }

    private LetExpr parseLet() {
        Token nameTok = peek();
        Expr target = parseExpr();
        if (!(target instanceof VarExpr binder)) {
            throw error(nameTok, "Expected variable after 'let'");
        }
        consume(TokenType.ASSIGN, "Expected '='");
        Expr bound = parseExpr();
        consume(TokenType.IN, "Expected 'in'");
        Expr body = parseExpr();
        return new LetExpr(binder, bound, body);
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParserException error(Token at, String msg) {
        return new ParserException(at, msg);
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS  -> BinaryExpr.Operator.ADD;
            case MINUS -> BinaryExpr.Operator.SUB;
            case STAR  -> BinaryExpr.Operator.MUL;
            case SLASH -> BinaryExpr.Operator.DIV;
            case LT    -> BinaryExpr.Operator.LT;
            case AND   -> BinaryExpr.Operator.AND;
            case OR    -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
