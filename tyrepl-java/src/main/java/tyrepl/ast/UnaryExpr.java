package tyrepl.ast;

public record UnaryExpr(
        Operator op,
        Expr expr
) implements Expr {
    public enum Operator {
        NOT
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
