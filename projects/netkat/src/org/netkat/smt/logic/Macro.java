package org.netkat.smt.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>A named, parameterized boolean formula, printed as an SMT-LIB2
 * <code>define-fun</code>. The body may only refer to the parameters and to
 * global declarations.</p>
 *
 * <p>A solver program can define each name only once, so macros are created
 * through a {@link org.netkat.smt.MacroCache} and compared by identity.</p>
 */
public final class Macro {

    private final String _name;

    private final List<Var> _params;

    private final Formula _body;

    public Macro(String name, List<Var> params, Formula body) {
        _name = name;
        _params = Collections.unmodifiableList(new ArrayList<>(params));
        _body = body;
    }

    public String getName() {
        return _name;
    }

    public List<Var> getParams() {
        return _params;
    }

    public Formula getBody() {
        return _body;
    }

    /**
     * Apply the macro to arguments matching its parameter sorts.
     */
    public MacroApp apply(Term... args) {
        return new MacroApp(this, args);
    }

    public void printDefinition(StringBuilder sb) {
        sb.append("(define-fun ").append(_name).append(" (");
        for (int i = 0; i < _params.size(); i++) {
            Var p = _params.get(i);
            if (i > 0) {
                sb.append(" ");
            }
            sb.append("(").append(p.getName()).append(" ").append(p.getSort().smtName()).append(")");
        }
        sb.append(") ").append(Sort.BOOL.smtName()).append(" ");
        _body.print(sb);
        sb.append(")");
    }

    @Override
    public String toString() {
        return _name;
    }
}
