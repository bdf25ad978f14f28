package tyrepl.ast;

public record BoolLiteral(boolean value) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBool(this);
    }
}
