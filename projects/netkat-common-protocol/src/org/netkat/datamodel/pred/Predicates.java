package org.netkat.datamodel.pred;

import org.netkat.datamodel.Field;

/**
 * Static factories for building predicates.
 */
public final class Predicates {

    public static final PacketPredicate TRUE = ConstantPredicate.TRUE;

    public static final PacketPredicate FALSE = ConstantPredicate.FALSE;

    private Predicates() {}

    public static PacketPredicate test(Field field, long value) {
        return new FieldTest(field, value);
    }

    public static PacketPredicate not(PacketPredicate pred) {
        return new Negation(pred);
    }

    public static PacketPredicate and(PacketPredicate left, PacketPredicate right) {
        return new Conjunction(left, right);
    }

    public static PacketPredicate or(PacketPredicate left, PacketPredicate right) {
        return new Disjunction(left, right);
    }

    /*
     * Right-nested conjunction of all predicates, true when there are none
     */
    public static PacketPredicate all(PacketPredicate... preds) {
        PacketPredicate acc = TRUE;
        for (int i = preds.length - 1; i >= 0; i--) {
            acc = (acc == TRUE ? preds[i] : and(preds[i], acc));
        }
        return acc;
    }

    /*
     * Right-nested disjunction of all predicates, false when there are none
     */
    public static PacketPredicate any(PacketPredicate... preds) {
        PacketPredicate acc = FALSE;
        for (int i = preds.length - 1; i >= 0; i--) {
            acc = (acc == FALSE ? preds[i] : or(preds[i], acc));
        }
        return acc;
    }
}
