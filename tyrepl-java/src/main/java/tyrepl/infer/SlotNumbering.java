package tyrepl.infer;

import com.google.common.flogger.FluentLogger;
import tyrepl.ast.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Pre-order numbering of tree positions. All occurrences of a variable name share the slot
 * allocated at its first occurrence, whether bound by {@code let} or free.
 */
public final class SlotNumbering implements Expr.Visitor<Void> {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Slots slots = new Slots();
    private final Map<String, Integer> variables = new HashMap<>();

    private SlotNumbering() {}

    public static Slots number(Expr root) {
        SlotNumbering numbering = new SlotNumbering();
        root.accept(numbering);
        logger.atFine().log("numbered %d slots, %d variables",
                numbering.slots.counter(), numbering.variables.size());
        return numbering.slots;
    }

    private void fresh(Expr node) {
        slots.assign(node, slots.allocate());
    }

    @Override
    public Void visitVar(VarExpr e) {
        Integer shared = variables.get(e.name());
        if (shared == null) {
            shared = slots.allocate();
            variables.put(e.name(), shared);
        }
        slots.assign(e, shared);
        return null;
    }

    @Override
    public Void visitInt(IntLiteral e) {
        fresh(e);
        return null;
    }

    @Override
    public Void visitBool(BoolLiteral e) {
        fresh(e);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        fresh(e);
        e.left().accept(this);
        e.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        fresh(e);
        e.expr().accept(this);
        return null;
    }

    @Override
    public Void visitIf(IfExpr e) {
        fresh(e);
        e.condition().accept(this);
        e.thenBranch().accept(this);
        e.elseBranch().accept(this);
        return null;
    }

    @Override
    public Void visitLet(LetExpr e) {
        fresh(e);
        e.var().accept(this);
        e.bound().accept(this);
        e.body().accept(this);
        return null;
    }
}
