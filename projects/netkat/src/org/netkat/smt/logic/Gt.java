package org.netkat.smt.logic;

public class Gt extends Comparison {

    public Gt(Term left, Term right) {
        super(left, right);
        if (left.getSort() != Sort.INT) {
            throw new IllegalArgumentException("Ordering on non-integer term " + left);
        }
    }

    @Override
    String operator() {
        return ">";
    }
}
