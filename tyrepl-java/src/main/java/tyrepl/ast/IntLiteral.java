package tyrepl.ast;

public record IntLiteral(int value) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInt(this);
    }
}
