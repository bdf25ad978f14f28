package tyrepl.ast;

/**
 * Expression tree of the language. Nodes are immutable and never shared between parents;
 * per-node analysis data is kept in identity-keyed side tables, not on the nodes.
 */
public sealed interface Expr
        permits VarExpr, IntLiteral, BoolLiteral,
        BinaryExpr, UnaryExpr, IfExpr, LetExpr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitVar(VarExpr e);
        R visitInt(IntLiteral e);
        R visitBool(BoolLiteral e);
        R visitBinary(BinaryExpr e);
        R visitUnary(UnaryExpr e);
        R visitIf(IfExpr e);
        R visitLet(LetExpr e);
    }
}
