package tyrepl.print;

import tyrepl.ast.*;

/** Renders a tree back to canonical source text that parses to an equal tree. */
public class AstPrinter implements Expr.Visitor<String> {

    public String print(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitVar(VarExpr e) {
        return e.name();
    }

    @Override
    public String visitInt(IntLiteral e) {
        return Integer.toString(e.value());
    }

    @Override
    public String visitBool(BoolLiteral e) {
        return Boolean.toString(e.value());
    }

    @Override
    public String visitBinary(BinaryExpr e) {
        return "(" + e.op().symbol() + " " + print(e.left()) + " " + print(e.right()) + ")";
    }

    @Override
    public String visitUnary(UnaryExpr e) {
        return "(! " + print(e.expr()) + ")";
    }

    @Override
    public String visitIf(IfExpr e) {
        return "(if " + print(e.condition()) + " then " + print(e.thenBranch()) + " else " + print(e.elseBranch()) + ")";
    }

    @Override
    public String visitLet(LetExpr e) {
        return "(let " + print(e.var()) + " = " + print(e.bound()) + " in " + print(e.body()) + ")";
    }
}
