package org.netkat.smt.logic;

/**
 * A non-boolean term of the encoding: a variable, an integer constant, or a
 * header field read from a packet.
 */
public abstract class Term {

    public abstract Sort getSort();

    public abstract void print(StringBuilder sb);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
