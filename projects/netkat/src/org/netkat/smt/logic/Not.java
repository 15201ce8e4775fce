package org.netkat.smt.logic;

public class Not extends Formula {

    private final Formula _formula;

    public Not(Formula formula) {
        _formula = formula;
    }

    public Formula getFormula() {
        return _formula;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("(not ");
        _formula.print(sb);
        sb.append(")");
    }
}
