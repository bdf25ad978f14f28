package tyrepl.ast;

/** {@code (let var = bound in body)}. The binder is a node of its own so it gets a slot. */
public record LetExpr(
        VarExpr var,
        Expr bound,
        Expr body
) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
