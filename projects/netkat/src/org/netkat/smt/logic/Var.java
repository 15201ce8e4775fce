package org.netkat.smt.logic;

public class Var extends Term {

    private final String _name;

    private final Sort _sort;

    public Var(String name, Sort sort) {
        _name = name;
        _sort = sort;
    }

    public String getName() {
        return _name;
    }

    @Override
    public Sort getSort() {
        return _sort;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(_name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Var var = (Var) o;
        return _name.equals(var._name) && _sort == var._sort;
    }

    @Override
    public int hashCode() {
        return 31 * _name.hashCode() + _sort.hashCode();
    }
}
