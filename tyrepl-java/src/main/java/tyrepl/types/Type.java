package tyrepl.types;

/** Inferred type of a variable: a base type or a generic class named by its union-find root. */
public sealed interface Type permits BaseType, GenericType {
    String render();
}
