package org.netkat.datamodel.policy;

/**
 * Kleene star: zero or more applications of the body.
 */
public final class Star extends Policy {

    private final Policy _body;

    public Star(Policy body) {
        _body = body;
    }

    public Policy getBody() {
        return _body;
    }

    @Override
    public String constructorName() {
        return "iteration";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _body.equals(((Star) o)._body);
    }

    @Override
    public int hashCode() {
        return 31 * _body.hashCode() + 11;
    }

    @Override
    public String toString() {
        return "(" + _body + ")*";
    }
}
