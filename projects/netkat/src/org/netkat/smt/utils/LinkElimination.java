package org.netkat.smt.utils;


import org.netkat.datamodel.Field;
import org.netkat.datamodel.policy.Choice;
import org.netkat.datamodel.policy.Link;
import org.netkat.datamodel.policy.Policies;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.policy.Sequence;
import org.netkat.datamodel.policy.Star;
import org.netkat.datamodel.policy.Union;
import org.netkat.datamodel.pred.Predicates;

/**
 * Rewrites link primitives into filters and modifications of the
 * <code>Switch</code> and <code>InPort</code> fields.
 */
public class LinkElimination {

    /**
     * Replace every <code>s1@p1 =&gt; s2@p2</code> with
     * <code>filter(Switch = s1 and InPort = p1); Switch := s2; InPort := p2</code>.
     */
    public static Policy removeLinks(Policy pol) {
        if (pol instanceof Link) {
            Link l = (Link) pol;
            Policy check = Policies.filter(Predicates.and(
                    Predicates.test(Field.SWITCH, l.getSwitch1()),
                    Predicates.test(Field.IN_PORT, l.getPort1())));
            return Policies.seq(check, Policies.modify(Field.SWITCH, l.getSwitch2()), Policies
                    .modify(Field.IN_PORT, l.getPort2()));
        }

        if (pol instanceof Union) {
            Union u = (Union) pol;
            return Policies.union(removeLinks(u.getLeft()), removeLinks(u.getRight()));
        }

        if (pol instanceof Sequence) {
            Sequence s = (Sequence) pol;
            return Policies.seq(removeLinks(s.getLeft()), removeLinks(s.getRight()));
        }

        if (pol instanceof Star) {
            return Policies.star(removeLinks(((Star) pol).getBody()));
        }

        if (pol instanceof Choice) {
            Choice c = (Choice) pol;
            return new Choice(removeLinks(c.getLeft()), c.getProbability(), removeLinks(c
                    .getRight()));
        }

        return pol;
    }
}
