package org.netkat.smt.logic;

public final class BoolConst extends Formula {

    public static final BoolConst TRUE = new BoolConst(true);

    public static final BoolConst FALSE = new BoolConst(false);

    private final boolean _value;

    private BoolConst(boolean value) {
        _value = value;
    }

    public static BoolConst of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return _value;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(_value ? "true" : "false");
    }
}
