package tyrepl.ast;

public record IfExpr(
        Expr condition,
        Expr thenBranch,
        Expr elseBranch
) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
