package org.netkat.smt;


import org.netkat.common.PolicyShapeException;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.policy.Sequence;
import org.netkat.datamodel.policy.Star;
import org.netkat.smt.logic.And;
import org.netkat.smt.logic.BoolConst;
import org.netkat.smt.logic.Comment;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.Or;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>Unrolls a program <code>(p;t)*</code> for every hop count from 0 to a
 * bound <code>k</code>.</p>
 *
 * <p>The relation for depth <code>d</code> is compiled on its own: the body
 * is compiled <code>d</code> times in a chain starting at the input packet,
 * and only the packet reached at the end of the chain is kept. Since the
 * depths do not share variables, a packet that is dropped before depth
 * <code>d</code> could never satisfy the depth <code>d</code> relation. Each
 * depth is therefore relaxed to</p>
 *
 * <pre>relation_d or reached_d = nopacket</pre>
 *
 * <p>so that a dropped packet satisfies every deeper depth vacuously.</p>
 */
public class BoundedUnroller {

    private final VerificationContext _ctx;

    private final PolicyCompiler _policies;

    public BoundedUnroller(VerificationContext ctx) {
        _ctx = ctx;
        _policies = new PolicyCompiler(ctx);
    }

    public Unrolling unroll(Policy program, SymbolicPacket in, int k) throws
            PolicyShapeException {
        if (k < 0) {
            throw new IllegalArgumentException("Negative hop bound: " + k);
        }
        Sequence body = loopBody(program);

        List<Formula> depths = new ArrayList<>();
        List<SymbolicPacket> frontier = new ArrayList<>();
        for (int d = 0; d <= k; d++) {
            CompiledPolicy hops = forward(body, in, d);
            SymbolicPacket reached = hops.getOutput();
            Formula dropped = annotate("dropped before reaching " + reached, reached.mkDropped());
            Formula relaxed = new Or(hops.getFormula(), dropped);
            depths.add(annotate("forward in " + d + " hops", relaxed));
            frontier.add(reached);
        }
        return new Unrolling(new And(depths), frontier);
    }

    /**
     * Check that a program has the shape <code>(p;t)*</code> and return its body.
     */
    public static Sequence loopBody(Policy program) throws PolicyShapeException {
        if (program instanceof Star) {
            Policy body = ((Star) program).getBody();
            if (body instanceof Sequence) {
                return (Sequence) body;
            }
        }
        throw new PolicyShapeException(program.constructorName(), "Program not of the form " +
                "(p;t)*");
    }

    /*
     * The relation for exactly d applications of the body
     */
    private CompiledPolicy forward(Sequence body, SymbolicPacket in, int d) throws
            PolicyShapeException {
        if (d == 0) {
            return new CompiledPolicy(BoolConst.TRUE, in);
        }
        List<Formula> chain = new ArrayList<>();
        SymbolicPacket current = in;
        for (int hop = 1; hop <= d; hop++) {
            CompiledPolicy pol = _policies.compile(body.getLeft(), current);
            CompiledPolicy topo = _policies.compile(body.getRight(), pol.getOutput());
            chain.add(annotate("hop " + hop + ": policy", pol.getFormula()));
            chain.add(annotate("hop " + hop + ": topology", topo.getFormula()));
            current = topo.getOutput();
        }
        return new CompiledPolicy(new And(chain), current);
    }

    private Formula annotate(String text, Formula f) {
        return _ctx.getAnnotate() ? new Comment(text, f) : f;
    }
}
