package org.netkat.smt.utils;


import org.netkat.datamodel.policy.Choice;
import org.netkat.datamodel.policy.Link;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.policy.Sequence;
import org.netkat.datamodel.policy.Star;
import org.netkat.datamodel.policy.Union;
import org.netkat.datamodel.topology.Topology;
import org.netkat.datamodel.topology.TopologyNode;

public class TopologyExtractor {

    /**
     * Build the switch graph connected by the links of a program. Switch
     * <code>n</code> is named <code>sn</code>.
     */
    public static Topology fromPolicy(Policy pol) {
        Topology topo = new Topology();
        collect(pol, topo);
        return topo;
    }

    private static void collect(Policy pol, Topology topo) {
        if (pol instanceof Link) {
            Link l = (Link) pol;
            TopologyNode src = topo.addSwitch("s" + l.getSwitch1(), l.getSwitch1());
            TopologyNode dst = topo.addSwitch("s" + l.getSwitch2(), l.getSwitch2());
            topo.addSwitchEdge(src, l.getPort1(), dst, l.getPort2());
        } else if (pol instanceof Union) {
            collect(((Union) pol).getLeft(), topo);
            collect(((Union) pol).getRight(), topo);
        } else if (pol instanceof Sequence) {
            collect(((Sequence) pol).getLeft(), topo);
            collect(((Sequence) pol).getRight(), topo);
        } else if (pol instanceof Choice) {
            collect(((Choice) pol).getLeft(), topo);
            collect(((Choice) pol).getRight(), topo);
        } else if (pol instanceof Star) {
            collect(((Star) pol).getBody(), topo);
        }
    }
}
