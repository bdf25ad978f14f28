package tyrepl.infer;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import tyrepl.ast.*;

/**
 * Emits the typing rule of every node as slot equalities, node first, then its children in
 * numbering order. The order is fixed so that generic root ids are reproducible.
 */
public final class ConstraintGenerator implements Expr.Visitor<Void> {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Slots slots;
    private final int intSlot;
    private final int boolSlot;
    private final ImmutableList.Builder<Constraint> constraints = ImmutableList.builder();

    private ConstraintGenerator(Slots slots) {
        this.slots = slots;
        this.intSlot = slots.intSlot();
        this.boolSlot = slots.boolSlot();
    }

    public static ImmutableList<Constraint> generate(Expr root, Slots slots) {
        ConstraintGenerator generator = new ConstraintGenerator(slots);
        root.accept(generator);
        ImmutableList<Constraint> result = generator.constraints.build();
        logger.atFine().log("generated %d constraints", result.size());
        return result;
    }

    private void equate(int left, int right) {
        constraints.add(new Constraint(left, right));
    }

    private int slot(Expr e) {
        return slots.slotOf(e);
    }

    @Override
    public Void visitVar(VarExpr e) {
        return null;
    }

    @Override
    public Void visitInt(IntLiteral e) {
        equate(slot(e), intSlot);
        return null;
    }

    @Override
    public Void visitBool(BoolLiteral e) {
        equate(slot(e), boolSlot);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        int result = switch (e.op()) {
            case ADD, SUB, MUL, DIV -> intSlot;
            case LT, AND, OR -> boolSlot;
        };
        int operand = switch (e.op()) {
            case ADD, SUB, MUL, DIV, LT -> intSlot;
            case AND, OR -> boolSlot;
        };
        equate(slot(e), result);
        equate(slot(e.left()), operand);
        equate(slot(e.right()), operand);
        e.left().accept(this);
        e.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        // NOT is the only unary operator
        equate(slot(e), boolSlot);
        equate(slot(e.expr()), boolSlot);
        e.expr().accept(this);
        return null;
    }

    @Override
    public Void visitIf(IfExpr e) {
        equate(slot(e), slot(e.thenBranch()));
        equate(slot(e.condition()), boolSlot);
        equate(slot(e.thenBranch()), slot(e.elseBranch()));
        e.condition().accept(this);
        e.thenBranch().accept(this);
        e.elseBranch().accept(this);
        return null;
    }

    @Override
    public Void visitLet(LetExpr e) {
        equate(slot(e), slot(e.body()));
        equate(slot(e.var()), slot(e.bound()));
        e.var().accept(this);
        e.bound().accept(this);
        e.body().accept(this);
        return null;
    }
}
