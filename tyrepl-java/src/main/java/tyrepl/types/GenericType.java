package tyrepl.types;

public record GenericType(int root) implements Type {

    @Override
    public String render() {
        return "GENERICS-" + root;
    }

    @Override
    public String toString() {
        return render();
    }
}
