package org.netkat.smt.logic;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class MacroApp extends Formula {

    private final Macro _macro;

    private final List<Term> _args;

    public MacroApp(Macro macro, Term... args) {
        List<Var> params = macro.getParams();
        if (params.size() != args.length) {
            throw new IllegalArgumentException("Macro " + macro + " expects " + params.size() + " " +
                    "arguments, got " + args.length);
        }
        for (int i = 0; i < args.length; i++) {
            if (params.get(i).getSort() != args[i].getSort()) {
                throw new IllegalArgumentException("Argument " + args[i] + " of " + macro + " " +
                        "should have sort " + params.get(i).getSort());
            }
        }
        _macro = macro;
        _args = Collections.unmodifiableList(Arrays.asList(args));
    }

    public Macro getMacro() {
        return _macro;
    }

    public List<Term> getArgs() {
        return _args;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("(").append(_macro.getName());
        for (Term t : _args) {
            sb.append(" ");
            t.print(sb);
        }
        sb.append(")");
    }
}
