package org.netkat.smt.logic;

/**
 * <p>A boolean formula of the encoding. Formulas are built by the predicate
 * and policy compilers and printed as SMT-LIB2 expressions.</p>
 */
public abstract class Formula {

    public abstract void print(StringBuilder sb);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
