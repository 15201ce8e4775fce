package org.netkat.smt.logic;

public class IntConst extends Term {

    private final long _value;

    public IntConst(long value) {
        _value = value;
    }

    public long getValue() {
        return _value;
    }

    @Override
    public Sort getSort() {
        return Sort.INT;
    }

    @Override
    public void print(StringBuilder sb) {
        // SMT-LIB numerals are unsigned
        if (_value < 0) {
            sb.append("(- ").append(Long.toString(_value).substring(1)).append(")");
        } else {
            sb.append(_value);
        }
    }
}
