package org.netkat.datamodel.topology;

/**
 * A directed link from a port of one node to a port of another.
 */
public class TopologyEdge {

    public static final long DEFAULT_COST = 0;

    public static final long DEFAULT_CAPACITY = Long.MAX_VALUE;

    private final TopologyNode _src;

    private final long _srcPort;

    private final TopologyNode _dst;

    private final long _dstPort;

    private final long _cost;

    private final long _capacity;

    public TopologyEdge(TopologyNode src, long srcPort, TopologyNode dst, long dstPort) {
        this(src, srcPort, dst, dstPort, DEFAULT_COST, DEFAULT_CAPACITY);
    }

    public TopologyEdge(TopologyNode src, long srcPort, TopologyNode dst, long dstPort, long
            cost, long capacity) {
        _src = src;
        _srcPort = srcPort;
        _dst = dst;
        _dstPort = dstPort;
        _cost = cost;
        _capacity = capacity;
    }

    public TopologyNode getSrc() {
        return _src;
    }

    public long getSrcPort() {
        return _srcPort;
    }

    public TopologyNode getDst() {
        return _dst;
    }

    public long getDstPort() {
        return _dstPort;
    }

    public long getCost() {
        return _cost;
    }

    public long getCapacity() {
        return _capacity;
    }

    /**
     * The same link traversed in the other direction.
     */
    public TopologyEdge reverse() {
        return new TopologyEdge(_dst, _dstPort, _src, _srcPort, _cost, _capacity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        TopologyEdge that = (TopologyEdge) o;

        if (_srcPort != that._srcPort) return false;
        if (_dstPort != that._dstPort) return false;
        if (_cost != that._cost) return false;
        if (_capacity != that._capacity) return false;
        if (!_src.equals(that._src)) return false;
        return _dst.equals(that._dst);
    }

    @Override
    public int hashCode() {
        int result = _src.hashCode();
        result = 31 * result + Long.hashCode(_srcPort);
        result = 31 * result + _dst.hashCode();
        result = 31 * result + Long.hashCode(_dstPort);
        result = 31 * result + Long.hashCode(_cost);
        result = 31 * result + Long.hashCode(_capacity);
        return result;
    }

    @Override
    public String toString() {
        return _src + "," + _srcPort + " --> " + _dst + "," + _dstPort;
    }
}
