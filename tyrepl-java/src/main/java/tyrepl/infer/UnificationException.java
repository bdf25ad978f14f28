package tyrepl.infer;

import tyrepl.TyReplException;
import tyrepl.types.BaseType;

public class UnificationException extends TyReplException {

    private final BaseType left;
    private final BaseType right;

    public UnificationException(BaseType left, BaseType right) {
        super(Kind.UNIFICATION, "Cannot unify " + left.render() + " with " + right.render());
        this.left = left;
        this.right = right;
    }

    public BaseType left() {
        return left;
    }

    public BaseType right() {
        return right;
    }
}
