package tyrepl.infer;

/** "Slot {@code left} and slot {@code right} denote the same type." */
public record Constraint(int left, int right) {
    @Override
    public String toString() {
        return "[" + left + "] = [" + right + "]";
    }
}
