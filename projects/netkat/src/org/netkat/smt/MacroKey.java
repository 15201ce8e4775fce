package org.netkat.smt;

import org.netkat.datamodel.Field;

/**
 * Identifies a macro within one verification run: the macro family and the
 * header field it is specialized to.
 */
public class MacroKey {

    public enum Family {
        FIELD_EQUALS,
        FIELD_NOT_EQUALS,
        PACKET_EQUALS_EXCEPT,
        MODIFY
    }

    private final Family _family;

    private final Field _field;

    public MacroKey(Family family, Field field) {
        _family = family;
        _field = field;
    }

    public Family getFamily() {
        return _family;
    }

    public Field getField() {
        return _field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MacroKey that = (MacroKey) o;
        return _family == that._family && _field == that._field;
    }

    @Override
    public int hashCode() {
        return 31 * _family.hashCode() + _field.hashCode();
    }

    @Override
    public String toString() {
        return _family + "(" + _field + ")";
    }
}
