package org.netkat.smt.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An n-ary conjunction or disjunction. The empty junction prints as its
 * unit and a singleton prints as its only operand.
 */
public abstract class Junction extends Formula {

    private final List<Formula> _operands;

    Junction(List<Formula> operands) {
        _operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    Junction(Formula... operands) {
        this(Arrays.asList(operands));
    }

    public List<Formula> getOperands() {
        return _operands;
    }

    abstract String operator();

    abstract BoolConst unit();

    @Override
    public void print(StringBuilder sb) {
        if (_operands.isEmpty()) {
            unit().print(sb);
            return;
        }
        if (_operands.size() == 1) {
            _operands.get(0).print(sb);
            return;
        }
        sb.append("(").append(operator());
        for (Formula f : _operands) {
            sb.append(" ");
            f.print(sb);
        }
        sb.append(")");
    }
}
