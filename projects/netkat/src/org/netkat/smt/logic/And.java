package org.netkat.smt.logic;

import java.util.List;

public class And extends Junction {

    public And(List<Formula> operands) {
        super(operands);
    }

    public And(Formula... operands) {
        super(operands);
    }

    @Override
    String operator() {
        return "and";
    }

    @Override
    BoolConst unit() {
        return BoolConst.TRUE;
    }
}
