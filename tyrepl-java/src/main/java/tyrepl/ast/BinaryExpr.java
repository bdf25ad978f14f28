package tyrepl.ast;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"),
        LT("<"),
        AND("&&"), OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
