package org.netkat.datamodel.policy;

import org.netkat.datamodel.pred.PacketPredicate;

public final class Filter extends Policy {

    private final PacketPredicate _predicate;

    public Filter(PacketPredicate predicate) {
        _predicate = predicate;
    }

    public PacketPredicate getPredicate() {
        return _predicate;
    }

    @Override
    public String constructorName() {
        return "filter";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _predicate.equals(((Filter) o)._predicate);
    }

    @Override
    public int hashCode() {
        return _predicate.hashCode();
    }

    @Override
    public String toString() {
        return "filter " + _predicate;
    }
}
