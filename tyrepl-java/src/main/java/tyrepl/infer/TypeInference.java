package tyrepl.infer;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import tyrepl.ast.Expr;
import tyrepl.lexer.Lexer;
import tyrepl.lexer.Token;
import tyrepl.parser.Parser;

import java.util.List;

/**
 * Runs the whole pipeline for one line of source: lexing, parsing, slot numbering,
 * constraint generation, unification and report building. Holds no state between calls.
 */
public final class TypeInference {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /** Every intermediate artefact of one successful run. */
    public record Analysis(
            Expr ast,
            Slots slots,
            ImmutableList<Constraint> constraints,
            TypeReport report
    ) {}

    /**
     * @throws tyrepl.lexer.LexerException on an unrecognised character
     * @throws tyrepl.parser.ParserException when the tokens do not match the grammar
     * @throws UnificationException when INT and BOOL are forced together
     */
    public TypeReport infer(String line) {
        return analyze(line).report();
    }

    public Analysis analyze(String line) {
        List<Token> tokens = new Lexer(line).tokenize();
        Expr ast = new Parser(tokens).parse();
        return analyze(ast);
    }

    public Analysis analyze(Expr ast) {
        Slots slots = SlotNumbering.number(ast);
        ImmutableList<Constraint> constraints = ConstraintGenerator.generate(ast, slots);
        UnionFind classes = Unifier.solve(constraints, slots.counter());
        TypeReport report = ReportBuilder.build(ast, slots, classes);
        logger.atFine().log("inferred %d variable types", report.types().size());
        return new Analysis(ast, slots, constraints, report);
    }
}
