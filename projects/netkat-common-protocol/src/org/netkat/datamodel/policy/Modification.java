package org.netkat.datamodel.policy;

import org.netkat.datamodel.Field;

/**
 * Sets one header field to a constant, leaving the other fields unchanged.
 */
public final class Modification extends Policy {

    private final Field _field;

    private final long _value;

    public Modification(Field field, long value) {
        if (field == null) {
            throw new IllegalArgumentException("Modification without a field");
        }
        _field = field;
        _value = value;
    }

    public Field getField() {
        return _field;
    }

    public long getValue() {
        return _value;
    }

    @Override
    public String constructorName() {
        return "modification";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Modification that = (Modification) o;
        return _value == that._value && _field == that._field;
    }

    @Override
    public int hashCode() {
        int result = _field.hashCode();
        result = 31 * result + Long.hashCode(_value);
        return result;
    }

    @Override
    public String toString() {
        return _field + " := " + _value;
    }
}
