package org.netkat.datamodel.topology;

import org.netkat.common.TopologyLookupException;
import org.netkat.common.TopologyLookupException.Kind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * <p>A directed, port-labeled graph of hosts and switches.</p>
 *
 * <p>The topology supplies the hop bound of a reachability check: the
 * longest shortest path between two switches. Lookups of missing nodes,
 * ports and paths fail with a {@link TopologyLookupException}.</p>
 */
public class Topology {

    private Map<TopologyNode, List<TopologyEdge>> _outEdges;

    private Map<TopologyNode, List<TopologyEdge>> _inEdges;

    public Topology() {
        _outEdges = new LinkedHashMap<>();
        _inEdges = new LinkedHashMap<>();
    }

    public TopologyNode addNode(TopologyNode n) {
        _outEdges.putIfAbsent(n, new ArrayList<>());
        _inEdges.putIfAbsent(n, new ArrayList<>());
        return n;
    }

    public TopologyNode addHost(String name) {
        return addNode(TopologyNode.host(name));
    }

    public TopologyNode addSwitch(String name, long switchId) {
        return addNode(TopologyNode.switchNode(name, switchId));
    }

    /**
     * Add a link from port <code>srcPort</code> of <code>src</code> to port
     * <code>dstPort</code> of <code>dst</code>. Missing nodes are added.
     */
    public TopologyEdge addSwitchEdge(TopologyNode src, long srcPort, TopologyNode dst, long
            dstPort) {
        return addEdge(new TopologyEdge(src, srcPort, dst, dstPort));
    }

    public TopologyEdge addEdge(TopologyEdge e) {
        addNode(e.getSrc());
        addNode(e.getDst());
        List<TopologyEdge> out = _outEdges.get(e.getSrc());
        if (!out.contains(e)) {
            out.add(e);
            _inEdges.get(e.getDst()).add(e);
        }
        return e;
    }

    public boolean containsNode(TopologyNode n) {
        return _outEdges.containsKey(n);
    }

    public List<TopologyNode> getVertices() {
        return new ArrayList<>(_outEdges.keySet());
    }

    public List<TopologyEdge> getEdges() {
        List<TopologyEdge> acc = new ArrayList<>();
        _outEdges.forEach((n, edges) -> acc.addAll(edges));
        return acc;
    }

    public List<TopologyNode> getHosts() {
        List<TopologyNode> acc = new ArrayList<>();
        for (TopologyNode n : _outEdges.keySet()) {
            if (!n.isSwitch()) {
                acc.add(n);
            }
        }
        return acc;
    }

    public List<TopologyNode> getSwitches() {
        List<TopologyNode> acc = new ArrayList<>();
        for (TopologyNode n : _outEdges.keySet()) {
            if (n.isSwitch()) {
                acc.add(n);
            }
        }
        return acc;
    }

    public List<Long> getSwitchIds() {
        List<Long> acc = new ArrayList<>();
        for (TopologyNode n : getSwitches()) {
            acc.add(n.getSwitchId());
        }
        return acc;
    }

    /**
     * Find the switch with the given datapath id.
     */
    public TopologyNode getSwitch(long switchId) throws TopologyLookupException {
        for (TopologyNode n : getSwitches()) {
            if (n.getSwitchId() == switchId) {
                return n;
            }
        }
        throw new TopologyLookupException(Kind.NODE_NOT_FOUND, "Can't find switch " + switchId);
    }

    /**
     * The first link from <code>src</code> to <code>dst</code>, which
     * carries the port pair connecting them.
     */
    public TopologyEdge findEdge(TopologyNode src, TopologyNode dst) throws
            TopologyLookupException {
        for (TopologyEdge e : outEdges(src, "findEdge")) {
            if (e.getDst().equals(dst)) {
                return e;
            }
        }
        throw new TopologyLookupException(Kind.NODE_NOT_FOUND, "Can't find " + src + " to get " +
                "ports to " + dst);
    }

    /**
     * All ports of a node that are connected to some link.
     */
    public SortedSet<Long> portsOfSwitch(TopologyNode n) throws TopologyLookupException {
        SortedSet<Long> acc = new TreeSet<>();
        for (TopologyEdge e : outEdges(n, "portsOfSwitch")) {
            acc.add(e.getSrcPort());
        }
        for (TopologyEdge e : _inEdges.get(n)) {
            acc.add(e.getDstPort());
        }
        return acc;
    }

    /**
     * The ports of a node that are connected to hosts.
     */
    public SortedSet<Long> edgePortsOfSwitch(TopologyNode n) throws TopologyLookupException {
        SortedSet<Long> acc = new TreeSet<>();
        for (TopologyEdge e : outEdges(n, "edgePortsOfSwitch")) {
            if (!e.getDst().isSwitch()) {
                acc.add(e.getSrcPort());
            }
        }
        for (TopologyEdge e : _inEdges.get(n)) {
            if (!e.getSrc().isSwitch()) {
                acc.add(e.getDstPort());
            }
        }
        return acc;
    }

    /**
     * The node reached by leaving <code>n</code> through <code>port</code>.
     */
    public TopologyNode nextHop(TopologyNode n, long port) throws TopologyLookupException {
        for (TopologyEdge e : outEdges(n, "nextHop")) {
            if (e.getSrcPort() == port) {
                return e.getDst();
            }
        }
        throw new TopologyLookupException(Kind.NODE_NOT_FOUND, "nextHop: Port " + port + " of "
                + n + " is not connected");
    }

    /**
     * Find a path with the fewest links between two nodes.
     *
     * @return the links of the path, empty when <code>src</code> equals <code>dst</code>
     * @throws TopologyLookupException if a node is missing or no path exists
     */
    public List<TopologyEdge> shortestPath(TopologyNode src, TopologyNode dst) throws
            TopologyLookupException {
        outEdges(dst, "shortestPath");
        Map<TopologyNode, TopologyEdge> parents = new HashMap<>();
        Map<TopologyNode, Integer> dist = distancesFrom(src, parents);
        if (!dist.containsKey(dst)) {
            throw new TopologyLookupException(Kind.NO_PATH, "No path from " + src + " to " + dst);
        }
        LinkedList<TopologyEdge> path = new LinkedList<>();
        TopologyNode current = dst;
        while (!current.equals(src)) {
            TopologyEdge e = parents.get(current);
            path.addFirst(e);
            current = e.getSrc();
        }
        return path;
    }

    /**
     * The largest number of links on a shortest path between two switches.
     * Pairs of switches with no path between them are ignored, so a topology
     * without links has a bound of 0.
     */
    public int longestShortestPath() {
        int max = 0;
        for (TopologyNode s : getSwitches()) {
            Map<TopologyNode, Integer> dist = distancesFrom(s, new HashMap<>());
            for (Map.Entry<TopologyNode, Integer> entry : dist.entrySet()) {
                if (entry.getKey().isSwitch()) {
                    max = Math.max(max, entry.getValue());
                }
            }
        }
        return max;
    }

    /*
     * Breadth-first search from src, recording the edge used to reach each node
     */
    private Map<TopologyNode, Integer> distancesFrom(TopologyNode src, Map<TopologyNode,
            TopologyEdge> parents) {
        outEdges(src, "shortestPath");
        Map<TopologyNode, Integer> dist = new HashMap<>();
        Queue<TopologyNode> queue = new ArrayDeque<>();
        dist.put(src, 0);
        queue.add(src);
        while (!queue.isEmpty()) {
            TopologyNode n = queue.remove();
            int d = dist.get(n);
            for (TopologyEdge e : _outEdges.get(n)) {
                TopologyNode next = e.getDst();
                if (!dist.containsKey(next)) {
                    dist.put(next, d + 1);
                    parents.put(next, e);
                    queue.add(next);
                }
            }
        }
        return dist;
    }

    private List<TopologyEdge> outEdges(TopologyNode n, String operation) {
        List<TopologyEdge> edges = _outEdges.get(n);
        if (edges == null) {
            throw new TopologyLookupException(Kind.NODE_NOT_FOUND, "Can't find " + n + " to get " +
                    operation);
        }
        return Collections.unmodifiableList(edges);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("---------- Links of each node ----------\n");
        _outEdges.forEach((n, edges) -> {
            sb.append("Node: ").append(n).append("\n");
            for (TopologyEdge e : edges) {
                sb.append("  ").append(e).append("\n");
            }
        });
        return sb.toString();
    }
}
