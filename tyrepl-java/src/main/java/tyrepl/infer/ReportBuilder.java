package tyrepl.infer;

import tyrepl.ast.*;
import tyrepl.types.BaseType;
import tyrepl.types.GenericType;
import tyrepl.types.Type;

import java.util.LinkedHashMap;
import java.util.Map;

/** Resolves every variable occurrence to the type of its class. */
public final class ReportBuilder implements Expr.Visitor<Void> {

    private final Slots slots;
    private final UnionFind classes;
    private final Map<String, Type> types = new LinkedHashMap<>();

    private ReportBuilder(Slots slots, UnionFind classes) {
        this.slots = slots;
        this.classes = classes;
    }

    public static TypeReport build(Expr root, Slots slots, UnionFind classes) {
        ReportBuilder builder = new ReportBuilder(slots, classes);
        root.accept(builder);
        return new TypeReport(builder.types);
    }

    private Type resolve(int slot) {
        int root = classes.find(slot);
        if (root == slots.intSlot()) return BaseType.INT;
        if (root == slots.boolSlot()) return BaseType.BOOL;
        return new GenericType(root);
    }

    @Override
    public Void visitVar(VarExpr e) {
        types.putIfAbsent(e.name(), resolve(slots.slotOf(e)));
        return null;
    }

    @Override
    public Void visitInt(IntLiteral e) {
        return null;
    }

    @Override
    public Void visitBool(BoolLiteral e) {
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        e.left().accept(this);
        e.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        e.expr().accept(this);
        return null;
    }

    @Override
    public Void visitIf(IfExpr e) {
        e.condition().accept(this);
        e.thenBranch().accept(this);
        e.elseBranch().accept(this);
        return null;
    }

    @Override
    public Void visitLet(LetExpr e) {
        e.var().accept(this);
        e.bound().accept(this);
        e.body().accept(this);
        return null;
    }
}
