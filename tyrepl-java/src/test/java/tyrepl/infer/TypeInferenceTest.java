package tyrepl.infer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tyrepl.TyReplException;
import tyrepl.lexer.LexerException;
import tyrepl.parser.ParserException;
import tyrepl.types.BaseType;
import tyrepl.types.GenericType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeInferenceTest {

    private final TypeInference inference = new TypeInference();

    private List<String> lines(String src) {
        return inference.infer(src).lines(ReportOrder.SORTED);
    }

    @Test
    void infer_let_of_literal() {
        assertEquals(List.of("x :: INT"), lines("(let x = 1 in x)"));
    }

    @Test
    void infer_condition_is_bool() {
        assertEquals(List.of("x :: BOOL"), lines("(if x then 0 else 1)"));
    }

    @Test
    void infer_generic_classes_across_nested_lets() {
        assertEquals(List.of(
                "w :: GENERICS-5",
                "x :: GENERICS-2",
                "y :: GENERICS-2",
                "z :: GENERICS-5"
        ), lines("(let x = y in (let z = w in 0))"));
    }

    @Test
    void infer_appearance_order() {
        var report = inference.infer("(let x = y in (let z = w in 0))");
        assertEquals(List.of("x", "y", "z", "w"), List.copyOf(report.types(ReportOrder.APPEARANCE).keySet()));
        assertEquals(List.of("w", "x", "y", "z"), List.copyOf(report.types(ReportOrder.SORTED).keySet()));
    }

    @Test
    void infer_free_variable_alone_is_generic() {
        var report = inference.infer("x");
        assertEquals(new GenericType(0), report.typeOf("x"));
        assertEquals("x :: GENERICS-0", report.toString());
    }

    @Test
    void infer_branch_conflict() {
        var e = assertThrows(UnificationException.class, () -> inference.infer("(if true then false else 0)"));
        assertEquals(BaseType.BOOL, e.left());
        assertEquals(BaseType.INT, e.right());
    }

    @Test
    void infer_operand_conflict() {
        var e = assertThrows(UnificationException.class, () -> inference.infer("(< x (< 1 2))"));
        assertEquals(BaseType.INT, e.left());
        assertEquals(BaseType.BOOL, e.right());
    }

    @Test
    void infer_variable_used_at_two_types_conflicts() {
        assertThrows(UnificationException.class, () -> inference.infer("(if x then (- x 1) else 0)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1",
            "true",
            "(- 1 2)",
            "(if (< 1 2) then (* 3 4) else (- 5 -6))",
            "(if (&& true (! false)) then (|| false true) else (< (/ 8 2) (+ 1 1)))",
            "(if (if true then false else true) then (if false then 1 else 2) else (* (- 0 1) 3))"
    })
    void infer_closed_expressions_report_nothing(String src) {
        assertTrue(inference.infer(src).isEmpty());
    }

    @Test
    void infer_same_name_bound_and_free_is_one_variable() {
        var report = inference.infer("(+ x (let x = 1 in x))");
        assertEquals(1, report.types().size());
        assertEquals(BaseType.INT, report.typeOf("x"));
    }

    @Test
    void infer_shared_name_reports_one_type_for_every_occurrence() {
        var report = inference.infer("(let a = b in (if c then a else b))");
        assertEquals(report.typeOf("a"), report.typeOf("b"));
        assertEquals(BaseType.BOOL, report.typeOf("c"));
        assertTrue(report.typeOf("a") instanceof GenericType);
    }

    @Test
    void infer_let_binding_flows_into_body() {
        assertEquals(List.of("x :: BOOL", "y :: INT"), lines("(let x = true in (if x then y else 0))"));
    }

    @Test
    void infer_logical_and_arithmetic_operators() {
        assertEquals(List.of("a :: BOOL", "b :: BOOL"), lines("(&& a (! b))"));
        assertEquals(List.of("x :: INT"), lines("(+ x -3)"));
        assertEquals(List.of("p :: BOOL", "q :: BOOL"), lines("(|| p q)"));
    }

    @Test
    void infer_variable_typed_through_let_chain() {
        var report = inference.infer("(let f = g in (let h = f in (* h 2)))");
        assertEquals(BaseType.INT, report.typeOf("f"));
        assertEquals(BaseType.INT, report.typeOf("g"));
        assertEquals(BaseType.INT, report.typeOf("h"));
    }

    @Test
    void analyze_exposes_intermediate_results() {
        var analysis = inference.analyze("(let x = 1 in x)");
        assertEquals(3, analysis.slots().counter());
        assertEquals(3, analysis.constraints().size());
        assertEquals(BaseType.INT, analysis.report().typeOf("x"));
    }

    @Test
    void infer_propagates_lexical_and_syntax_failures() {
        var lex = assertThrows(LexerException.class, () -> inference.infer("(+ 1 #)"));
        assertEquals(TyReplException.Kind.LEXICAL, lex.kind());
        var syntax = assertThrows(ParserException.class, () -> inference.infer("(let 1 = 2 in 3)"));
        assertEquals(TyReplException.Kind.SYNTAX, syntax.kind());
    }

    @Test
    void infer_deepest_allowed_closed_expression_reports_nothing() {
        int depth = tyrepl.parser.Parser.MAX_DEPTH;
        String src = "(- 1 ".repeat(depth) + "0" + ")".repeat(depth);
        assertTrue(inference.infer(src).isEmpty());
    }

    @Test
    void infer_rejects_too_deep_expression_as_syntax_error() {
        String src = "(! ".repeat(50_000) + "true" + ")".repeat(50_000);
        var e = assertThrows(ParserException.class, () -> inference.infer(src));
        assertEquals(TyReplException.Kind.SYNTAX, e.kind());
    }

    @Test
    void runs_do_not_share_state() {
        lines("(let x = 1 in x)");
        assertEquals(List.of("x :: BOOL"), lines("(! x)"));
    }
}
