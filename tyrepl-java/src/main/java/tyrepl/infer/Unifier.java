package tyrepl.infer;

import com.google.common.flogger.FluentLogger;
import tyrepl.types.BaseType;

import java.util.List;

/**
 * Solves slot equalities into a partition. Slots below {@code counter} are type variables;
 * {@code counter} and {@code counter + 1} stand for INT and BOOL. A base type always ends up
 * as the root of its class, and merging two classes rooted at different base types fails.
 */
public final class Unifier {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final int counter;
    private final UnionFind classes;

    public Unifier(int counter) {
        this.counter = counter;
        this.classes = new UnionFind(counter + 2);
    }

    public static UnionFind solve(List<Constraint> constraints, int counter) {
        Unifier unifier = new Unifier(counter);
        for (Constraint c : constraints) {
            unifier.unify(c.left(), c.right());
        }
        logger.atFine().log("solved %d constraints over %d slots", constraints.size(), counter + 2);
        return unifier.classes;
    }

    public void unify(int x, int y) {
        int rx = classes.find(x);
        int ry = classes.find(y);
        boolean xVar = isVariable(rx);
        boolean yVar = isVariable(ry);

        if (xVar) {
            classes.join(rx, ry);
        } else if (yVar) {
            classes.join(ry, rx);
        } else if (rx != ry) {
            throw new UnificationException(baseType(rx), baseType(ry));
        }
    }

    public int find(int slot) {
        return classes.find(slot);
    }

    private boolean isVariable(int slot) {
        return slot < counter;
    }

    private BaseType baseType(int slot) {
        return slot == counter ? BaseType.INT : BaseType.BOOL;
    }
}
