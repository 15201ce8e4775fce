package org.netkat.datamodel.pred;

/**
 * A boolean combination of tests on packet header fields. Predicates are
 * immutable once built.
 */
public abstract class PacketPredicate {

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

}
