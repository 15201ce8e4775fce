package org.netkat.smt;


import org.netkat.common.NetKatException;
import org.netkat.datamodel.pred.ConstantPredicate;
import org.netkat.datamodel.pred.Conjunction;
import org.netkat.datamodel.pred.Disjunction;
import org.netkat.datamodel.pred.FieldTest;
import org.netkat.datamodel.pred.Negation;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.smt.logic.And;
import org.netkat.smt.logic.BoolConst;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.IntConst;
import org.netkat.smt.logic.Or;

/**
 * <p>Compiles a packet predicate to a formula over one packet variable.</p>
 *
 * <p>The result is in negation normal form. Negations are pushed through
 * the predicate before the field tests are compiled, so a negated test
 * becomes an application of the field's <code>not-equals</code> macro
 * rather than a negated <code>equals</code>.</p>
 */
public class PredicateCompiler {

    private final PacketMacros _macros;

    public PredicateCompiler(VerificationContext ctx) {
        _macros = ctx.getMacros();
    }

    public Formula compile(PacketPredicate pred, SymbolicPacket pkt) {
        if (pred instanceof ConstantPredicate) {
            return BoolConst.of(((ConstantPredicate) pred).getValue());
        }

        if (pred instanceof FieldTest) {
            FieldTest t = (FieldTest) pred;
            return _macros.fieldEquals(t.getField()).apply(pkt.getTerm(), new IntConst(t
                    .getValue()));
        }

        if (pred instanceof Negation) {
            return compileNegated(((Negation) pred).getPredicate(), pkt);
        }

        if (pred instanceof Conjunction) {
            Conjunction c = (Conjunction) pred;
            return new And(compile(c.getLeft(), pkt), compile(c.getRight(), pkt));
        }

        if (pred instanceof Disjunction) {
            Disjunction d = (Disjunction) pred;
            return new Or(compile(d.getLeft(), pkt), compile(d.getRight(), pkt));
        }

        throw new NetKatException("Unknown predicate: " + pred);
    }

    /*
     * Compile the negation of pred
     */
    private Formula compileNegated(PacketPredicate pred, SymbolicPacket pkt) {
        if (pred instanceof ConstantPredicate) {
            return BoolConst.of(!((ConstantPredicate) pred).getValue());
        }

        if (pred instanceof FieldTest) {
            FieldTest t = (FieldTest) pred;
            return _macros.fieldNotEquals(t.getField()).apply(pkt.getTerm(), new IntConst(t
                    .getValue()));
        }

        if (pred instanceof Negation) {
            return compile(((Negation) pred).getPredicate(), pkt);
        }

        if (pred instanceof Conjunction) {
            Conjunction c = (Conjunction) pred;
            return new Or(compileNegated(c.getLeft(), pkt), compileNegated(c.getRight(), pkt));
        }

        if (pred instanceof Disjunction) {
            Disjunction d = (Disjunction) pred;
            return new And(compileNegated(d.getLeft(), pkt), compileNegated(d.getRight(), pkt));
        }

        throw new NetKatException("Unknown predicate: " + pred);
    }
}
