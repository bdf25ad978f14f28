package tyrepl.ast;

public record VarExpr(String name) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVar(this);
    }
}
