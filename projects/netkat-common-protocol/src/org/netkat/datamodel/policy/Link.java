package org.netkat.datamodel.policy;

/**
 * A topology primitive: packets at <code>switch1</code> on
 * <code>port1</code> move to <code>switch2</code>, arriving on
 * <code>port2</code>.
 */
public final class Link extends Policy {

    private final long _switch1;

    private final long _port1;

    private final long _switch2;

    private final long _port2;

    public Link(long switch1, long port1, long switch2, long port2) {
        _switch1 = switch1;
        _port1 = port1;
        _switch2 = switch2;
        _port2 = port2;
    }

    public long getSwitch1() {
        return _switch1;
    }

    public long getPort1() {
        return _port1;
    }

    public long getSwitch2() {
        return _switch2;
    }

    public long getPort2() {
        return _port2;
    }

    @Override
    public String constructorName() {
        return "link " + this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Link link = (Link) o;
        return _switch1 == link._switch1 && _port1 == link._port1
                && _switch2 == link._switch2 && _port2 == link._port2;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(_switch1);
        result = 31 * result + Long.hashCode(_port1);
        result = 31 * result + Long.hashCode(_switch2);
        result = 31 * result + Long.hashCode(_port2);
        return result;
    }

    @Override
    public String toString() {
        return _switch1 + "@" + _port1 + " => " + _switch2 + "@" + _port2;
    }
}
