package org.netkat.smt.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.netkat.datamodel.policy.Policies.link;
import static org.netkat.datamodel.policy.Policies.loop;
import static org.netkat.datamodel.policy.Policies.union;

import java.util.Arrays;
import org.junit.Test;
import org.netkat.datamodel.Field;
import org.netkat.datamodel.policy.Policies;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.topology.Topology;
import org.netkat.datamodel.topology.TopologyEdge;
import org.netkat.datamodel.topology.TopologyNode;

public class TopologyExtractorTest {

  @Test
  public void testRing() {
    Policy topo = union(Arrays.asList(link(1, 2, 2, 1), link(2, 2, 3, 1), link(3, 2, 1, 1)));
    Topology t = TopologyExtractor.fromPolicy(loop(Policies.modify(Field.VLAN, 1), topo));

    assertThat(t.getSwitchIds(), contains(1L, 2L, 3L));
    assertThat(t.getEdges(), hasSize(3));
    TopologyNode s1 = t.getSwitch(1);
    assertThat(s1.getName(), equalTo("s1"));
    TopologyEdge e = t.findEdge(s1, t.getSwitch(2));
    assertThat(e.getSrcPort(), equalTo(2L));
    assertThat(e.getDstPort(), equalTo(1L));
    assertThat(t.longestShortestPath(), equalTo(2));
  }

  @Test
  public void testNoLinks() {
    Topology t = TopologyExtractor.fromPolicy(loop(Policies.ID, Policies.ID));
    assertThat(t.getVertices(), empty());
    assertThat(t.longestShortestPath(), equalTo(0));
  }
}
