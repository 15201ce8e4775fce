package org.netkat.smt.logic;

/**
 * Boolean if-then-else.
 */
public class Ite extends Formula {

    private final Formula _cond;

    private final Formula _then;

    private final Formula _else;

    public Ite(Formula cond, Formula thenCase, Formula elseCase) {
        _cond = cond;
        _then = thenCase;
        _else = elseCase;
    }

    public Formula getCond() {
        return _cond;
    }

    public Formula getThen() {
        return _then;
    }

    public Formula getElse() {
        return _else;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("(ite ");
        _cond.print(sb);
        sb.append(" ");
        _then.print(sb);
        sb.append(" ");
        _else.print(sb);
        sb.append(")");
    }
}
