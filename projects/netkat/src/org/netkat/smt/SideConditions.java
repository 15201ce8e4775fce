package org.netkat.smt;


import org.netkat.datamodel.Field;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.smt.logic.IntConst;
import org.netkat.smt.logic.Not;

/**
 * Common side conditions on reached packets.
 */
public final class SideConditions {

    private SideConditions() {}

    /**
     * The reached packet is not the drop sentinel.
     */
    public static SideCondition notDropped() {
        return (pkt, ctx) -> new Not(pkt.mkDropped());
    }

    /**
     * The reached packet is not dropped and has <code>value</code> in <code>field</code>.
     */
    public static SideCondition fieldEquals(Field field, long value) {
        return (pkt, ctx) -> ctx.getMacros().fieldEquals(field).apply(pkt.getTerm(), new IntConst(
                value));
    }

    /**
     * The reached packet is dropped or has some other value in <code>field</code>.
     */
    public static SideCondition fieldNotEquals(Field field, long value) {
        return (pkt, ctx) -> ctx.getMacros().fieldNotEquals(field).apply(pkt.getTerm(),
                new IntConst(value));
    }

    public static SideCondition holds(PacketPredicate pred) {
        return (pkt, ctx) -> new PredicateCompiler(ctx).compile(pred, pkt);
    }
}
