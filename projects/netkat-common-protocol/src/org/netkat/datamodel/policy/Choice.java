package org.netkat.datamodel.policy;

/**
 * Probabilistic choice: the left branch with the given probability,
 * otherwise the right branch.
 */
public final class Choice extends Policy {

    private final Policy _left;

    private final Policy _right;

    private final double _probability;

    public Choice(Policy left, double probability, Policy right) {
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("Choice probability out of range: " + probability);
        }
        _left = left;
        _right = right;
        _probability = probability;
    }

    public Policy getLeft() {
        return _left;
    }

    public Policy getRight() {
        return _right;
    }

    public double getProbability() {
        return _probability;
    }

    @Override
    public String constructorName() {
        return "probabilistic choice";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Choice that = (Choice) o;
        return Double.compare(that._probability, _probability) == 0
                && _left.equals(that._left) && _right.equals(that._right);
    }

    @Override
    public int hashCode() {
        int result = _left.hashCode();
        result = 31 * result + _right.hashCode();
        result = 31 * result + Double.hashCode(_probability);
        return result;
    }

    @Override
    public String toString() {
        return "(" + _left + " [" + _probability + "] " + _right + ")";
    }
}
