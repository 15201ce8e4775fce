package org.netkat.smt.logic;

import java.util.List;

public class Or extends Junction {

    public Or(List<Formula> operands) {
        super(operands);
    }

    public Or(Formula... operands) {
        super(operands);
    }

    @Override
    String operator() {
        return "or";
    }

    @Override
    BoolConst unit() {
        return BoolConst.FALSE;
    }
}
