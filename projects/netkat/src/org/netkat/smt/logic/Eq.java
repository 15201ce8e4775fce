package org.netkat.smt.logic;

public class Eq extends Comparison {

    public Eq(Term left, Term right) {
        super(left, right);
    }

    @Override
    String operator() {
        return "=";
    }
}
