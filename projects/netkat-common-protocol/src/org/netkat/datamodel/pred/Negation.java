package org.netkat.datamodel.pred;

public final class Negation extends PacketPredicate {

    private final PacketPredicate _pred;

    public Negation(PacketPredicate pred) {
        _pred = pred;
    }

    public PacketPredicate getPredicate() {
        return _pred;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _pred.equals(((Negation) o)._pred);
    }

    @Override
    public int hashCode() {
        return 31 * _pred.hashCode() + 7;
    }

    @Override
    public String toString() {
        return "!(" + _pred + ")";
    }
}
