package tyrepl.infer;

/** Order in which a {@link TypeReport} lists its variables. */
public enum ReportOrder {
    /** Alphabetical by variable name. */
    SORTED,
    /** First occurrence in a pre-order walk of the expression. */
    APPEARANCE
}
