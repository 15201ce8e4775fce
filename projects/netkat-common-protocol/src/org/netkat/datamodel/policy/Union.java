package org.netkat.datamodel.policy;

/**
 * Parallel composition: the packets produced by either branch.
 */
public final class Union extends Policy {

    private final Policy _left;

    private final Policy _right;

    public Union(Policy left, Policy right) {
        _left = left;
        _right = right;
    }

    public Policy getLeft() {
        return _left;
    }

    public Policy getRight() {
        return _right;
    }

    @Override
    public String constructorName() {
        return "union";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Union that = (Union) o;
        return _left.equals(that._left) && _right.equals(that._right);
    }

    @Override
    public int hashCode() {
        int result = getClass().hashCode();
        result = 31 * result + _left.hashCode();
        result = 31 * result + _right.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "(" + _left + " + " + _right + ")";
    }
}
