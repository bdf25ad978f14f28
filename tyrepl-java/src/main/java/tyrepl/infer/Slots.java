package tyrepl.infer;

import static com.google.common.base.Preconditions.checkArgument;

import tyrepl.ast.Expr;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Slot assignment produced by {@link SlotNumbering}. Keyed by node identity: two structurally
 * equal literals are still distinct positions.
 */
public final class Slots {

    private final Map<Expr, Integer> slots = new IdentityHashMap<>();
    private int counter = 0;

    int allocate() {
        return counter++;
    }

    void assign(Expr node, int slot) {
        checkArgument(slot >= 0 && slot < counter, "slot %s not allocated", slot);
        Integer previous = slots.put(node, slot);
        checkArgument(previous == null, "node %s numbered twice", node);
    }

    public int slotOf(Expr node) {
        Integer slot = slots.get(node);
        checkArgument(slot != null, "node %s has no slot", node);
        return slot;
    }

    /** Number of slots allocated to tree positions. */
    public int counter() {
        return counter;
    }

    public int intSlot() {
        return counter;
    }

    public int boolSlot() {
        return counter + 1;
    }

    /** Tree slots plus the two base-type slots. */
    public int domainSize() {
        return counter + 2;
    }
}
