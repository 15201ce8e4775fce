package org.netkat.smt;


import org.netkat.datamodel.Field;
import org.netkat.smt.logic.Eq;
import org.netkat.smt.logic.FieldAccess;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.Sort;
import org.netkat.smt.logic.Var;

/**
 * <p>A packet variable of the encoding. Each packet is a constant of the
 * uninterpreted sort <code>Packet</code>, and each header field is a
 * function from packets to integers.</p>
 *
 * <p>{@link #NO_PACKET} is the drop sentinel: the value of a packet that was
 * filtered out or does not exist.</p>
 */
public class SymbolicPacket {

    public static final SymbolicPacket NO_PACKET = new SymbolicPacket("nopacket");

    private final String _name;

    private final Var _var;

    SymbolicPacket(String name) {
        _name = name;
        _var = new Var(name, Sort.PACKET);
    }

    public String getName() {
        return _name;
    }

    public Var getTerm() {
        return _var;
    }

    public boolean isNoPacket() {
        return this.equals(NO_PACKET);
    }

    public FieldAccess mkField(Field f) {
        return new FieldAccess(f, _var);
    }

    /**
     * The two variables denote the same packet.
     */
    public Formula mkEqual(SymbolicPacket other) {
        return new Eq(_var, other._var);
    }

    public Formula mkDropped() {
        return mkEqual(NO_PACKET);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _name.equals(((SymbolicPacket) o)._name);
    }

    @Override
    public int hashCode() {
        return _name.hashCode();
    }

    @Override
    public String toString() {
        return _name;
    }

}
