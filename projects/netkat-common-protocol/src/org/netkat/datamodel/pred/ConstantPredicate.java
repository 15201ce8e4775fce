package org.netkat.datamodel.pred;

public final class ConstantPredicate extends PacketPredicate {

    public static final ConstantPredicate TRUE = new ConstantPredicate(true);

    public static final ConstantPredicate FALSE = new ConstantPredicate(false);

    private final boolean _value;

    private ConstantPredicate(boolean value) {
        _value = value;
    }

    public boolean getValue() {
        return _value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _value == ((ConstantPredicate) o)._value;
    }

    @Override
    public int hashCode() {
        return _value ? 1 : 0;
    }

    @Override
    public String toString() {
        return _value ? "true" : "false";
    }
}
