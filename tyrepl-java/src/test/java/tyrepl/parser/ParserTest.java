package tyrepl.parser;

import tyrepl.ast.*;
import tyrepl.lexer.Lexer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Expr parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parse();
    }

    @Test
    void parse_atoms() {
        assertEquals(new VarExpr("x"), parse("x"));
        assertEquals(new IntLiteral(42), parse("42"));
        assertEquals(new IntLiteral(-7), parse("-7"));
        assertEquals(new BoolLiteral(false), parse("false"));
    }

    @Test
    void parse_binary_forms() {
        assertEquals(new BinaryExpr(new IntLiteral(1), BinaryExpr.Operator.SUB, new IntLiteral(2)), parse("(- 1 2)"));
        assertEquals(new BinaryExpr(new VarExpr("a"), BinaryExpr.Operator.LT, new VarExpr("b")), parse("(< a b)"));
        assertEquals(BinaryExpr.Operator.MUL, ((BinaryExpr) parse("(* 1 2)")).op());
        assertEquals(BinaryExpr.Operator.DIV, ((BinaryExpr) parse("(/ 1 2)")).op());
        assertEquals(BinaryExpr.Operator.ADD, ((BinaryExpr) parse("(+ 1 2)")).op());
        assertEquals(BinaryExpr.Operator.AND, ((BinaryExpr) parse("(&& a b)")).op());
        assertEquals(BinaryExpr.Operator.OR, ((BinaryExpr) parse("(|| a b)")).op());
    }

    @Test
    void parse_not() {
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NOT, new VarExpr("p")), parse("(! p)"));
    }

    @Test
    void parse_nested_operands() {
        var e = (BinaryExpr) parse("(- (* x 2) -1)");
        assertTrue(e.left() instanceof BinaryExpr);
        assertEquals(new IntLiteral(-1), e.right());
    }

    @Test
    void parse_if() {
        var e = (IfExpr) parse("(if c then 1 else 2)");
        assertEquals(new VarExpr("c"), e.condition());
        assertEquals(new IntLiteral(1), e.thenBranch());
        assertEquals(new IntLiteral(2), e.elseBranch());
    }

    @Test
    void parse_let() {
        assertEquals(
                new LetExpr(new VarExpr("x"), new IntLiteral(1), new VarExpr("x")),
                parse("(let x = 1 in x)"));
    }

    @Test
    void parse_let_requires_variable() {
        var e = assertThrows(ParserException.class, () -> parse("(let 1 = 2 in 3)"));
        assertEquals(5, e.offset());
        assertThrows(ParserException.class, () -> parse("(let (- x 1) = 2 in 3)"));
    }

    @Test
    void parse_missing_then_reports_offset() {
        var e = assertThrows(ParserException.class, () -> parse("(if true 1 else 2)"));
        assertEquals(9, e.offset());
        assertEquals("Syntax error: [9] Expected 'then' (got INT_LITERAL '1')", e.diagnostic());
    }

    @Test
    void parse_unclosed_form_reports_end_of_input() {
        var e = assertThrows(ParserException.class, () -> parse("(- 1 2"));
        assertTrue(e.getMessage().endsWith("Expected ')' (got end of input)"), e.getMessage());
    }

    private static String nestedNot(int depth) {
        return "(! ".repeat(depth) + "true" + ")".repeat(depth);
    }

    @Test
    void parse_nesting_up_to_limit() {
        var e = parse(nestedNot(Parser.MAX_DEPTH));
        for (int i = 0; i < Parser.MAX_DEPTH; i++) {
            e = ((UnaryExpr) e).expr();
        }
        assertEquals(new BoolLiteral(true), e);
    }

    @Test
    void parse_nesting_past_limit_throws() {
        var e = assertThrows(ParserException.class, () -> parse(nestedNot(Parser.MAX_DEPTH + 1)));
        assertEquals(Parser.MAX_DEPTH * 3 + 1, e.offset());
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
        assertThrows(ParserException.class, () -> parse(nestedNot(100_000)));
    }

    @Test
    void parse_sibling_forms_do_not_accumulate_depth() {
        String side = nestedNot(Parser.MAX_DEPTH - 1);
        var e = (BinaryExpr) parse("(&& " + side + " " + side + ")");
        assertEquals(BinaryExpr.Operator.AND, e.op());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "(",
            ")",
            "(x 1 2)",
            "(-1 2)",
            "(- 1)",
            "(- 1 2 3)",
            "(! a b)",
            "(if true then 1)",
            "(if true then 1 2)",
            "(let x 1 in x)",
            "(let x = 1 x)",
            "(let x = 1 in x",
            "1 2",
            "then",
            "()"
    })
    void parse_malformed_input_throws(String src) {
        assertThrows(ParserException.class, () -> parse(src));
    }
}
