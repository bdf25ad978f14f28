package tyrepl.infer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import tyrepl.types.Type;

import java.util.Map;

/**
 * Inferred type of every distinct variable of one expression. The expression's own type is
 * not part of the report.
 */
public final class TypeReport {

    private final ImmutableMap<String, Type> types;

    TypeReport(Map<String, Type> types) {
        this.types = ImmutableMap.copyOf(types);
    }

    /** Variables in order of first appearance. */
    public ImmutableMap<String, Type> types() {
        return types;
    }

    public ImmutableMap<String, Type> types(ReportOrder order) {
        return switch (order) {
            case SORTED -> ImmutableSortedMap.copyOf(types);
            case APPEARANCE -> types;
        };
    }

    public Type typeOf(String name) {
        return types.get(name);
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    /** One {@code name :: TYPE} line per variable. */
    public ImmutableList<String> lines(ReportOrder order) {
        ImmutableList.Builder<String> lines = ImmutableList.builder();
        types(order).forEach((name, type) -> lines.add(name + " :: " + type.render()));
        return lines.build();
    }

    @Override
    public String toString() {
        return String.join("\n", lines(ReportOrder.SORTED));
    }
}
