package org.netkat.smt;


import org.netkat.common.PolicyShapeException;
import org.netkat.datamodel.policy.Filter;
import org.netkat.datamodel.policy.Modification;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.policy.Sequence;
import org.netkat.datamodel.policy.Union;
import org.netkat.smt.logic.And;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.IntConst;
import org.netkat.smt.logic.Or;

/**
 * <p>Compiles a star-free, link-free policy to a relation between an input
 * packet variable and an output packet variable.</p>
 *
 * <ul>
 *     <li>A filter constrains the input and outputs the same variable.</li>
 *     <li>A modification outputs a fresh variable related by the field's
 *     <code>mod</code> macro.</li>
 *     <li>Both branches of a union start from the same input, and their outputs
 *     are unified: either branch may hold, but they name one resulting packet.</li>
 *     <li>A sequence threads the output of the first policy into the second.</li>
 * </ul>
 */
public class PolicyCompiler {

    private final VerificationContext _ctx;

    private final PredicateCompiler _predicates;

    public PolicyCompiler(VerificationContext ctx) {
        _ctx = ctx;
        _predicates = new PredicateCompiler(ctx);
    }

    public CompiledPolicy compile(Policy pol, SymbolicPacket in) throws PolicyShapeException {
        if (pol instanceof Filter) {
            Filter f = (Filter) pol;
            return new CompiledPolicy(_predicates.compile(f.getPredicate(), in), in);
        }

        if (pol instanceof Modification) {
            Modification m = (Modification) pol;
            SymbolicPacket out = _ctx.freshPacket();
            Formula rel = _ctx.getMacros().modify(m.getField()).apply(in.getTerm(), out.getTerm(),
                    new IntConst(m.getValue()));
            return new CompiledPolicy(rel, out);
        }

        if (pol instanceof Union) {
            Union u = (Union) pol;
            CompiledPolicy left = compile(u.getLeft(), in);
            CompiledPolicy right = compile(u.getRight(), in);
            Formula rel = new And(new Or(left.getFormula(), right.getFormula()), left.getOutput()
                    .mkEqual(right.getOutput()));
            return new CompiledPolicy(rel, left.getOutput());
        }

        if (pol instanceof Sequence) {
            Sequence s = (Sequence) pol;
            CompiledPolicy first = compile(s.getLeft(), in);
            CompiledPolicy second = compile(s.getRight(), first.getOutput());
            return new CompiledPolicy(new And(first.getFormula(), second.getFormula()), second
                    .getOutput());
        }

        throw new PolicyShapeException(pol.constructorName(), "Policy not in accepted normal form");
    }
}
