package org.netkat.datamodel.topology;

/**
 * A vertex of the topology: a host, or a switch with its datapath id.
 */
public class TopologyNode implements Comparable<TopologyNode> {

    public enum Type {
        HOST,
        SWITCH
    }

    private final Type _type;

    private final String _name;

    private final long _switchId;

    private TopologyNode(Type type, String name, long switchId) {
        _type = type;
        _name = name;
        _switchId = switchId;
    }

    public static TopologyNode host(String name) {
        return new TopologyNode(Type.HOST, name, -1);
    }

    public static TopologyNode switchNode(String name, long switchId) {
        return new TopologyNode(Type.SWITCH, name, switchId);
    }

    public Type getType() {
        return _type;
    }

    public String getName() {
        return _name;
    }

    public boolean isSwitch() {
        return _type == Type.SWITCH;
    }

    public long getSwitchId() {
        if (_type != Type.SWITCH) {
            throw new IllegalStateException("Not a switch: " + _name);
        }
        return _switchId;
    }

    @Override
    public int compareTo(TopologyNode o) {
        int cmp = _type.compareTo(o._type);
        if (cmp != 0) {
            return cmp;
        }
        cmp = _name.compareTo(o._name);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compare(_switchId, o._switchId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        TopologyNode that = (TopologyNode) o;

        if (_switchId != that._switchId) return false;
        if (_type != that._type) return false;
        return _name.equals(that._name);
    }

    @Override
    public int hashCode() {
        int result = _type.hashCode();
        result = 31 * result + _name.hashCode();
        result = 31 * result + Long.hashCode(_switchId);
        return result;
    }

    @Override
    public String toString() {
        return _name;
    }
}
