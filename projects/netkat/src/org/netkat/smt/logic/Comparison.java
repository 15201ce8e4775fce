package org.netkat.smt.logic;

/**
 * An atom relating two terms of the same sort.
 */
public abstract class Comparison extends Formula {

    private final Term _left;

    private final Term _right;

    Comparison(Term left, Term right) {
        if (left.getSort() != right.getSort()) {
            throw new IllegalArgumentException("Cannot compare " + left + " of sort " + left
                    .getSort() + " with " + right + " of sort " + right.getSort());
        }
        _left = left;
        _right = right;
    }

    public Term getLeft() {
        return _left;
    }

    public Term getRight() {
        return _right;
    }

    abstract String operator();

    @Override
    public void print(StringBuilder sb) {
        sb.append("(").append(operator()).append(" ");
        _left.print(sb);
        sb.append(" ");
        _right.print(sb);
        sb.append(")");
    }
}
