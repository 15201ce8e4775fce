package org.netkat.datamodel.pred;

public final class Disjunction extends PacketPredicate {

    private final PacketPredicate _left;

    private final PacketPredicate _right;

    public Disjunction(PacketPredicate left, PacketPredicate right) {
        _left = left;
        _right = right;
    }

    public PacketPredicate getLeft() {
        return _left;
    }

    public PacketPredicate getRight() {
        return _right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Disjunction that = (Disjunction) o;
        return _left.equals(that._left) && _right.equals(that._right);
    }

    @Override
    public int hashCode() {
        int result = _left.hashCode();
        result = 31 * result + _right.hashCode();
        return result * 5;
    }

    @Override
    public String toString() {
        return "(" + _left + " or " + _right + ")";
    }
}
