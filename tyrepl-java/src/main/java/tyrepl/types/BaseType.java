package tyrepl.types;

public enum BaseType implements Type {
    INT,
    BOOL;

    @Override
    public String render() {
        return name();
    }
}
