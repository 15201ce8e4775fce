package org.netkat.datamodel.policy;

import org.netkat.datamodel.Field;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.datamodel.pred.Predicates;

import java.util.List;

/**
 * Static factories for building policies.
 */
public final class Policies {

    public static final Policy ID = new Filter(Predicates.TRUE);

    public static final Policy DROP = new Filter(Predicates.FALSE);

    private Policies() {}

    public static Policy filter(PacketPredicate pred) {
        return new Filter(pred);
    }

    public static Policy modify(Field field, long value) {
        return new Modification(field, value);
    }

    public static Policy union(Policy left, Policy right) {
        return new Union(left, right);
    }

    public static Policy seq(Policy left, Policy right) {
        return new Sequence(left, right);
    }

    /*
     * Right-nested sequence of all policies, the identity when there are none
     */
    public static Policy seq(Policy... pols) {
        if (pols.length == 0) {
            return ID;
        }
        Policy acc = pols[pols.length - 1];
        for (int i = pols.length - 2; i >= 0; i--) {
            acc = seq(pols[i], acc);
        }
        return acc;
    }

    /*
     * Right-nested union of all policies, drop when there are none
     */
    public static Policy union(List<Policy> pols) {
        if (pols.isEmpty()) {
            return DROP;
        }
        Policy acc = pols.get(pols.size() - 1);
        for (int i = pols.size() - 2; i >= 0; i--) {
            acc = union(pols.get(i), acc);
        }
        return acc;
    }

    public static Policy star(Policy body) {
        return new Star(body);
    }

    public static Policy link(long switch1, long port1, long switch2, long port2) {
        return new Link(switch1, port1, switch2, port2);
    }

    /**
     * Build the program <code>(policy;topology)*</code>.
     */
    public static Policy loop(Policy policy, Policy topology) {
        return star(seq(policy, topology));
    }
}
