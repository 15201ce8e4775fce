package org.netkat.smt.logic;

public class Lt extends Comparison {

    public Lt(Term left, Term right) {
        super(left, right);
        if (left.getSort() != Sort.INT) {
            throw new IllegalArgumentException("Ordering on non-integer term " + left);
        }
    }

    @Override
    String operator() {
        return "<";
    }
}
